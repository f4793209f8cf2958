package it.aboutbits.clustersecret.crd.clustersecret;

import io.fabric8.kubernetes.api.model.Secret;
import it.aboutbits.clustersecret.core.KubernetesUtil;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.BiPredicate;

/// Describes the first difference between an observed managed Secret and the desired one.
///
/// The result is empty when the Secret is up-to-date, otherwise one of `name`, `type`,
/// `labels: <detail>`, `annotations: <detail>` or `data: <detail>`, checked in that order.
/// The last-sync annotation is ignored on both sides.
@NullMarked
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class SecretDiff {
    public static String diff(
            Secret observed,
            Secret desired,
            String lastSyncAnnotation
    ) {
        if (!Objects.equals(observed.getMetadata().getName(), desired.getMetadata().getName())) {
            return "name";
        }

        if (!Objects.equals(typeOf(observed), typeOf(desired))) {
            return "type";
        }

        var labels = diffMaps(
                nullToEmpty(desired.getMetadata().getLabels()),
                nullToEmpty(observed.getMetadata().getLabels()),
                Objects::equals
        );
        if (!labels.isEmpty()) {
            return "labels: " + labels;
        }

        var annotations = diffMaps(
                withoutKey(desired.getMetadata().getAnnotations(), lastSyncAnnotation),
                withoutKey(observed.getMetadata().getAnnotations(), lastSyncAnnotation),
                Objects::equals
        );
        if (!annotations.isEmpty()) {
            return "annotations: " + annotations;
        }

        var data = diffMaps(
                nullToEmpty(desired.getData()),
                nullToEmpty(observed.getData()),
                SecretDiff::sameBytes
        );
        if (!data.isEmpty()) {
            return "data: " + data;
        }

        return "";
    }

    /// Keys are scanned in sorted order so the reported key is stable.
    static String diffMaps(
            Map<String, String> want,
            Map<String, String> got,
            BiPredicate<String, String> equal
    ) {
        for (var key : new TreeSet<>(want.keySet())) {
            if (!got.containsKey(key)) {
                return "missing key: \"%s\"".formatted(key);
            }

            if (!equal.test(want.get(key), got.get(key))) {
                return "value does not match on key: \"%s\"".formatted(key);
            }
        }

        for (var key : new TreeSet<>(got.keySet())) {
            if (!want.containsKey(key)) {
                return "excess key: \"%s\"".formatted(key);
            }
        }

        return "";
    }

    private static boolean sameBytes(
            @Nullable String want,
            @Nullable String got
    ) {
        if (Objects.equals(want, got)) {
            return true;
        }

        if (want == null || got == null) {
            return false;
        }

        try {
            return Arrays.equals(
                    KubernetesUtil.decodeData(want),
                    KubernetesUtil.decodeData(got)
            );
        } catch (IllegalArgumentException e) {
            // Undecodable values differ unless textually equal
            return false;
        }
    }

    private static String typeOf(Secret secret) {
        var type = secret.getType();

        return type == null || type.isBlank() ? KubernetesUtil.SECRET_TYPE_OPAQUE : type;
    }

    private static Map<String, String> withoutKey(
            @Nullable Map<String, String> map,
            String key
    ) {
        var copy = new HashMap<>(nullToEmpty(map));
        copy.remove(key);

        return copy;
    }

    private static Map<String, String> nullToEmpty(@Nullable Map<String, String> map) {
        return map == null ? Map.of() : map;
    }
}
