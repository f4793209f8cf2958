package it.aboutbits.clustersecret.crd.clustersecret;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import it.aboutbits.clustersecret.core.ClusterSecretMarkers;
import it.aboutbits.clustersecret.core.KubernetesUtil;
import it.aboutbits.clustersecret.core.ObjectStore;
import it.aboutbits.clustersecret.core.SecretKeyReference;
import it.aboutbits.clustersecret.core.SecretReference;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the Secret every matched namespace should hold.
 * <p>
 * Data is layered, later layers overwriting earlier ones key by key:
 * <ol>
 *     <li>the whole data of every {@code spec.dataFrom} Secret, in list order</li>
 *     <li>the single keys of {@code spec.dataValueFrom}</li>
 *     <li>{@code spec.template.data}</li>
 *     <li>{@code spec.template.stringData}</li>
 * </ol>
 * The result never carries the last-sync annotation; it is only stamped when a Secret is written.
 */
@NullMarked
@Slf4j
@Singleton
@RequiredArgsConstructor
public class DesiredSecretService {
    private final ObjectStore objectStore;
    private final ClusterSecretMarkers markers;

    public String desiredName(ClusterSecret clusterSecret) {
        var metadata = clusterSecret.getSpec().getTemplate().getMetadata();

        if (metadata != null && metadata.getName() != null && !metadata.getName().isBlank()) {
            return metadata.getName();
        }

        return clusterSecret.getMetadata().getName();
    }

    /// @throws SecretSynthesisException if a referenced Secret or key cannot be resolved
    public Secret synthesize(ClusterSecret clusterSecret) {
        var spec = clusterSecret.getSpec();
        var template = spec.getTemplate();
        var name = desiredName(clusterSecret);

        var templateMetadata = template.getMetadata() != null
                ? template.getMetadata()
                : new SecretTemplateMetadata();

        var labels = new LinkedHashMap<>(nullToEmpty(templateMetadata.getLabels()));
        labels.putIfAbsent(markers.managedByLabel(), markers.managedByValue());

        var annotations = new LinkedHashMap<>(nullToEmpty(templateMetadata.getAnnotations()));
        annotations.put(markers.createdByAnnotation(), markers.createdByValue());
        annotations.put(markers.versionAnnotation(), markers.version());
        annotations.remove(markers.lastSyncAnnotation());

        var data = new LinkedHashMap<String, String>();

        var dataFrom = nullToEmpty(spec.getDataFrom());
        for (var index = 0; index < dataFrom.size(); index++) {
            data.putAll(resolveDataFrom(
                    name,
                    dataFrom.get(index),
                    "spec.dataFrom[%d]".formatted(index)
            ));
        }

        nullToEmpty(spec.getDataValueFrom()).forEach((key, dataValueFrom) -> data.put(
                key,
                resolveDataValueFrom(
                        name,
                        dataValueFrom,
                        "spec.dataValueFrom.%s".formatted(key)
                )
        ));

        data.putAll(nullToEmpty(template.getData()));

        nullToEmpty(template.getStringData()).forEach((key, value) -> data.put(
                key,
                KubernetesUtil.encodeData(value)
        ));

        var type = template.getType() == null || template.getType().isBlank()
                ? KubernetesUtil.SECRET_TYPE_OPAQUE
                : template.getType();

        return new SecretBuilder()
                .withNewMetadata()
                .withName(name)
                .withLabels(labels)
                .withAnnotations(annotations)
                .endMetadata()
                .withType(type)
                .withData(data)
                .build();
    }

    private Map<String, String> resolveDataFrom(
            String secretName,
            DataFrom dataFrom,
            String path
    ) {
        var ref = dataFrom.getSecretRef();

        if (ref == null) {
            throw new SecretSynthesisException(
                    secretName,
                    "%s: field .secretRef must be set".formatted(path)
            );
        }

        requireReference(secretName, ref, path);

        var secret = fetch(secretName, ref.getNamespace(), ref.getName(), path);

        return nullToEmpty(secret.getData());
    }

    private String resolveDataValueFrom(
            String secretName,
            DataValueFrom dataValueFrom,
            String path
    ) {
        var ref = dataValueFrom.getSecretKeyRef();

        if (ref == null) {
            throw new SecretSynthesisException(
                    secretName,
                    "%s: field .secretKeyRef must be set".formatted(path)
            );
        }

        requireKeyReference(secretName, ref, path);

        var secret = fetch(secretName, ref.getNamespace(), ref.getName(), path);
        var value = nullToEmpty(secret.getData()).get(ref.getKey());

        if (value == null) {
            throw new SecretSynthesisException(
                    secretName,
                    "%s: secret (%s) from namespace (%s) does not contain the data key (%s)".formatted(
                            path,
                            ref.getName(),
                            ref.getNamespace(),
                            ref.getKey()
                    )
            );
        }

        return value;
    }

    private Secret fetch(
            String secretName,
            String namespace,
            String name,
            String path
    ) {
        try {
            return objectStore.getSecret(namespace, name)
                    .orElseThrow(() -> new SecretSynthesisException(
                            secretName,
                            "%s: get secret (%s) from namespace (%s): not found".formatted(
                                    path,
                                    name,
                                    namespace
                            )
                    ));
        } catch (KubernetesClientException e) {
            throw new SecretSynthesisException(
                    secretName,
                    "%s: get secret (%s) from namespace (%s): %s".formatted(
                            path,
                            name,
                            namespace,
                            e.getMessage()
                    ),
                    e
            );
        }
    }

    private static void requireReference(
            String secretName,
            SecretReference ref,
            String path
    ) {
        requireField(secretName, ref.getName(), "%s: secretRef: field .name must be set".formatted(path));
        requireField(secretName, ref.getNamespace(), "%s: secretRef: field .namespace must be set".formatted(path));
    }

    private static void requireKeyReference(
            String secretName,
            SecretKeyReference ref,
            String path
    ) {
        requireField(secretName, ref.getName(), "%s: secretKeyRef: field .name must be set".formatted(path));
        requireField(secretName, ref.getNamespace(), "%s: secretKeyRef: field .namespace must be set".formatted(path));
        requireField(secretName, ref.getKey(), "%s: secretKeyRef: field .key must be set".formatted(path));
    }

    private static void requireField(
            String secretName,
            @Nullable String value,
            String message
    ) {
        if (value == null || value.isBlank()) {
            throw new SecretSynthesisException(secretName, message);
        }
    }

    private static <K, V> Map<K, V> nullToEmpty(@Nullable Map<K, V> map) {
        return map == null ? Map.of() : map;
    }

    private static <T> List<T> nullToEmpty(@Nullable List<T> list) {
        return list == null ? List.of() : list;
    }
}
