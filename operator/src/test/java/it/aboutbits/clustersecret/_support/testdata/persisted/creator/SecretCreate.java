package it.aboutbits.clustersecret._support.testdata.persisted.creator;

import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import it.aboutbits.clustersecret._support.InMemoryObjectStore;
import it.aboutbits.clustersecret._support.testdata.base.TestDataCreator;
import it.aboutbits.clustersecret.core.KubernetesUtil;
import it.aboutbits.clustersecret.crd.clustersecret.ClusterSecret;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/// Creates plain Secrets. Data values are given as plain text and stored base64 encoded.
@NullMarked
@Setter
@Accessors(fluent = true, chain = true)
public class SecretCreate extends TestDataCreator<Secret> {
    private final InMemoryObjectStore objectStore;

    @Nullable
    private String withNamespace;

    @Nullable
    private String withName;

    private String withType = KubernetesUtil.SECRET_TYPE_OPAQUE;

    private Map<String, String> withData = new LinkedHashMap<>();

    private Map<String, String> withLabels = new LinkedHashMap<>();

    private Map<String, String> withAnnotations = new LinkedHashMap<>();

    @Nullable
    private ClusterSecret withOwner;

    public SecretCreate(
            int numberOfItems,
            InMemoryObjectStore objectStore
    ) {
        super(numberOfItems);
        this.objectStore = objectStore;
    }

    public SecretCreate withEntry(
            String key,
            String plainValue
    ) {
        withData.put(key, plainValue);
        return this;
    }

    public SecretCreate withAnnotation(
            String key,
            String value
    ) {
        withAnnotations.put(key, value);
        return this;
    }

    @Override
    protected Secret create(int index) {
        var data = new LinkedHashMap<String, String>();
        withData.forEach((key, value) -> data.put(key, KubernetesUtil.encodeData(value)));

        var ownerReferences = new ArrayList<OwnerReference>();
        if (withOwner != null) {
            ownerReferences.add(KubernetesUtil.controllerReference(withOwner));
        }

        var item = new SecretBuilder()
                .withNewMetadata()
                .withNamespace(getNamespace())
                .withName(getName(index))
                .withLabels(new LinkedHashMap<>(withLabels))
                .withAnnotations(new LinkedHashMap<>(withAnnotations))
                .withOwnerReferences(ownerReferences)
                .endMetadata()
                .withType(withType)
                .withData(data)
                .build();

        return objectStore.putSecret(item);
    }

    private String getNamespace() {
        if (withNamespace != null) {
            return withNamespace;
        }

        withNamespace = randomKubernetesNameSuffix("test-source-ns");

        return withNamespace;
    }

    private String getName(int index) {
        if (withName != null) {
            return numberOfItems == 1 ? withName : "%s-%d".formatted(withName, index);
        }

        return randomKubernetesNameSuffix("test-secret");
    }
}
