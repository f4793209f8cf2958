package it.aboutbits.clustersecret._support.testdata.persisted.creator;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import it.aboutbits.clustersecret._support.InMemoryObjectStore;
import it.aboutbits.clustersecret._support.testdata.base.TestDataCreator;
import it.aboutbits.clustersecret.core.KubernetesUtil;
import it.aboutbits.clustersecret.core.SecretKeyReference;
import it.aboutbits.clustersecret.core.SecretReference;
import it.aboutbits.clustersecret.crd.clustersecret.ClusterSecret;
import it.aboutbits.clustersecret.crd.clustersecret.ClusterSecretSpec;
import it.aboutbits.clustersecret.crd.clustersecret.DataFrom;
import it.aboutbits.clustersecret.crd.clustersecret.DataValueFrom;
import it.aboutbits.clustersecret.crd.clustersecret.SecretTemplate;
import it.aboutbits.clustersecret.crd.clustersecret.SecretTemplateMetadata;
import it.aboutbits.clustersecret.selector.NamespaceAttributes;
import it.aboutbits.clustersecret.selector.NamespaceSelectorRequirement;
import it.aboutbits.clustersecret.selector.NamespaceSelectorTerm;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Creates ClusterSecrets. Template data values are given as plain text and stored base64 encoded.
@NullMarked
@Setter
@Accessors(fluent = true, chain = true)
public class ClusterSecretCreate extends TestDataCreator<ClusterSecret> {
    private final InMemoryObjectStore objectStore;

    @Nullable
    private String withName;

    /// Name of the replicated Secret; defaults to the ClusterSecret name when unset.
    @Nullable
    private String withSecretName;

    @Nullable
    private String withType;

    private List<NamespaceSelectorTerm> withTerms = new ArrayList<>();

    private Map<String, String> withData = new LinkedHashMap<>();

    private Map<String, String> withStringData = new LinkedHashMap<>();

    private Map<String, String> withSecretLabels = new LinkedHashMap<>();

    private Map<String, String> withSecretAnnotations = new LinkedHashMap<>();

    private List<DataFrom> withDataFrom = new ArrayList<>();

    private Map<String, DataValueFrom> withDataValueFrom = new LinkedHashMap<>();

    private List<String> withFinalizers = new ArrayList<>();

    private Map<String, String> withAnnotations = new LinkedHashMap<>();

    public ClusterSecretCreate(
            int numberOfItems,
            InMemoryObjectStore objectStore
    ) {
        super(numberOfItems);
        this.objectStore = objectStore;
    }

    public ClusterSecretCreate withTerm(NamespaceSelectorTerm term) {
        withTerms.add(term);
        return this;
    }

    /// Adds a term matching exactly the given namespace names.
    public ClusterSecretCreate selectingNamespaces(String... namespaces) {
        return withTerm(new NamespaceSelectorTerm(
                List.of(),
                List.of(new NamespaceSelectorRequirement(
                        NamespaceAttributes.FIELD_NAME,
                        "In",
                        Arrays.asList(namespaces)
                ))
        ));
    }

    public ClusterSecretCreate withEntry(
            String key,
            String plainValue
    ) {
        withData.put(key, plainValue);
        return this;
    }

    public ClusterSecretCreate withDataFromSecret(Secret source) {
        withDataFrom.add(new DataFrom(new SecretReference(
                source.getMetadata().getName(),
                source.getMetadata().getNamespace()
        )));
        return this;
    }

    public ClusterSecretCreate withDataValueFromSecret(
            String key,
            Secret source,
            String sourceKey
    ) {
        withDataValueFrom.put(key, new DataValueFrom(new SecretKeyReference(
                source.getMetadata().getName(),
                source.getMetadata().getNamespace(),
                sourceKey
        )));
        return this;
    }

    @Override
    protected ClusterSecret create(int index) {
        var item = new ClusterSecret();

        item.setMetadata(new ObjectMetaBuilder()
                .withName(getName(index))
                .withFinalizers(new ArrayList<>(withFinalizers))
                .withAnnotations(new LinkedHashMap<>(withAnnotations))
                .build()
        );

        var data = new LinkedHashMap<String, String>();
        withData.forEach((key, value) -> data.put(key, KubernetesUtil.encodeData(value)));

        var metadata = new SecretTemplateMetadata();
        metadata.setName(withSecretName);
        metadata.setLabels(new LinkedHashMap<>(withSecretLabels));
        metadata.setAnnotations(new LinkedHashMap<>(withSecretAnnotations));

        var template = new SecretTemplate();
        template.setMetadata(metadata);
        template.setData(data);
        template.setStringData(new LinkedHashMap<>(withStringData));
        if (withType != null) {
            template.setType(withType);
        }

        var spec = new ClusterSecretSpec();
        spec.setNamespaceSelectorTerms(new ArrayList<>(withTerms));
        spec.setTemplate(template);
        spec.setDataFrom(new ArrayList<>(withDataFrom));
        spec.setDataValueFrom(new LinkedHashMap<>(withDataValueFrom));

        item.setSpec(spec);

        return objectStore.putClusterSecret(item);
    }

    private String getName(int index) {
        if (withName != null) {
            return numberOfItems == 1 ? withName : "%s-%d".formatted(withName, index);
        }

        return randomKubernetesNameSuffix("test-csec");
    }
}
