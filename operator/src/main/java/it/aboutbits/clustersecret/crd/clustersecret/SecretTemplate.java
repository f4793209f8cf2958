package it.aboutbits.clustersecret.crd.clustersecret;

import it.aboutbits.clustersecret.core.KubernetesUtil;
import lombok.Getter;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/// Expected state of the replicated Secret.
@NullMarked
@Getter
@Setter
public class SecretTemplate {
    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private SecretTemplateMetadata metadata;

    /// Base64 encoded values, exactly like `Secret.data`. Wins over `dataFrom` and `dataValueFrom`.
    @io.fabric8.generator.annotation.Nullable
    private Map<String, String> data = new LinkedHashMap<>();

    /// Plain-text values, merged over `data`.
    @io.fabric8.generator.annotation.Nullable
    private Map<String, String> stringData = new LinkedHashMap<>();

    @io.fabric8.generator.annotation.Nullable
    private String type = KubernetesUtil.SECRET_TYPE_OPAQUE;
}
