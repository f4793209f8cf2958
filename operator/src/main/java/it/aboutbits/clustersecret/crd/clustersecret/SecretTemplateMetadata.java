package it.aboutbits.clustersecret.crd.clustersecret;

import lombok.Getter;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

@NullMarked
@Getter
@Setter
public class SecretTemplateMetadata {
    /// Name of the Secret to create. Defaults to the name of the ClusterSecret.
    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private String name;

    @io.fabric8.generator.annotation.Nullable
    private Map<String, String> labels = new LinkedHashMap<>();

    @io.fabric8.generator.annotation.Nullable
    private Map<String, String> annotations = new LinkedHashMap<>();
}
