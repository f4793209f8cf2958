package it.aboutbits.clustersecret._support.testdata.persisted.creator;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import it.aboutbits.clustersecret._support.InMemoryObjectStore;
import it.aboutbits.clustersecret._support.testdata.base.TestDataCreator;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

@NullMarked
@Setter
@Accessors(fluent = true, chain = true)
public class NamespaceCreate extends TestDataCreator<Namespace> {
    private final InMemoryObjectStore objectStore;

    @Nullable
    private String withName;

    private Map<String, String> withLabels = new LinkedHashMap<>();

    private String withPhase = "Active";

    public NamespaceCreate(
            int numberOfItems,
            InMemoryObjectStore objectStore
    ) {
        super(numberOfItems);
        this.objectStore = objectStore;
    }

    public NamespaceCreate withLabel(
            String key,
            String value
    ) {
        withLabels.put(key, value);
        return this;
    }

    @Override
    protected Namespace create(int index) {
        var item = new NamespaceBuilder()
                .withNewMetadata()
                .withName(getName(index))
                .withLabels(new LinkedHashMap<>(withLabels))
                .endMetadata()
                .withNewStatus()
                .withPhase(withPhase)
                .endStatus()
                .build();

        return objectStore.putNamespace(item);
    }

    private String getName(int index) {
        if (withName != null) {
            return numberOfItems == 1 ? withName : "%s-%d".formatted(withName, index);
        }

        return randomKubernetesNameSuffix("test-ns");
    }
}
