package it.aboutbits.clustersecret.core;

import io.fabric8.generator.annotation.Required;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;

/// Reference to a single data key of a Secret in any namespace.
@NullMarked
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SecretKeyReference {
    @Required
    private String name = "";

    @Required
    private String namespace = "";

    @Required
    private String key = "";
}
