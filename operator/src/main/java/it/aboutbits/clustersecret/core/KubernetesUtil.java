package it.aboutbits.clustersecret.core;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import it.aboutbits.clustersecret.crd.clustersecret.ClusterSecret;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.jspecify.annotations.NullMarked;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

@NullMarked
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class KubernetesUtil {
    public static final String SECRET_TYPE_OPAQUE = "Opaque";

    public static final int HTTP_NOT_FOUND = 404;
    public static final int HTTP_CONFLICT = 409;

    /// Controller owner reference pointing at the given ClusterSecret.
    public static OwnerReference controllerReference(ClusterSecret owner) {
        return new OwnerReferenceBuilder()
                .withApiVersion(HasMetadata.getApiVersion(ClusterSecret.class))
                .withKind(HasMetadata.getKind(ClusterSecret.class))
                .withName(owner.getMetadata().getName())
                .withUid(owner.getMetadata().getUid())
                .withController(true)
                .withBlockOwnerDeletion(true)
                .build();
    }

    /// The controller owner reference of the given object, if it points at a ClusterSecret.
    public static Optional<OwnerReference> clusterSecretController(HasMetadata resource) {
        var ownerReferences = resource.getMetadata().getOwnerReferences();

        //noinspection ConstantConditions
        if (ownerReferences == null) {
            return Optional.empty();
        }

        return ownerReferences.stream()
                .filter(ref -> Boolean.TRUE.equals(ref.getController()))
                .filter(ref -> HasMetadata.getApiVersion(ClusterSecret.class).equals(ref.getApiVersion()))
                .filter(ref -> HasMetadata.getKind(ClusterSecret.class).equals(ref.getKind()))
                .findFirst();
    }

    /// Whether the controller owner reference of the resource points at this incarnation of the
    /// ClusterSecret: name and uid must both match.
    public static boolean isControlledBy(
            HasMetadata resource,
            ClusterSecret owner
    ) {
        return clusterSecretController(resource)
                .map(ref -> Objects.equals(ref.getName(), owner.getMetadata().getName())
                        && Objects.equals(ref.getUid(), owner.getMetadata().getUid())
                )
                .orElse(false);
    }

    public static boolean isNotFound(KubernetesClientException e) {
        return e.getCode() == HTTP_NOT_FOUND;
    }

    public static boolean isConflict(KubernetesClientException e) {
        return e.getCode() == HTTP_CONFLICT;
    }

    public static byte[] decodeData(String base64) {
        return Base64.getDecoder().decode(base64);
    }

    public static String encodeData(String plainText) {
        return Base64.getEncoder().encodeToString(
                plainText.getBytes(StandardCharsets.UTF_8)
        );
    }
}
