package it.aboutbits.clustersecret.core;

import io.fabric8.generator.annotation.Required;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;

/// Reference to a whole Secret in any namespace.
@NullMarked
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SecretReference {
    @Required
    private String name = "";

    /**
     * The namespace where the Secret is located.
     * ClusterSecrets are cluster-scoped, so there is no namespace to fall back to.
     */
    @Required
    private String namespace = "";
}
