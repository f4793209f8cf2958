package it.aboutbits.clustersecret.crd.clustersecret;

import it.aboutbits.clustersecret.core.SecretKeyReference;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

@NullMarked
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DataValueFrom {
    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private SecretKeyReference secretKeyRef;
}
