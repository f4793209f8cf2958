package it.aboutbits.clustersecret.crd.clustersecret;

import lombok.Getter;
import org.jspecify.annotations.NullMarked;

/// The desired Secret could not be built because a referenced Secret or key does not resolve.
@NullMarked
@Getter
public class SecretSynthesisException extends IllegalStateException {
    /// Name the desired Secret would have had.
    private final String secretName;

    public SecretSynthesisException(
            String secretName,
            String message
    ) {
        super(message);
        this.secretName = secretName;
    }

    public SecretSynthesisException(
            String secretName,
            String message,
            Throwable cause
    ) {
        super(message, cause);
        this.secretName = secretName;
    }
}
