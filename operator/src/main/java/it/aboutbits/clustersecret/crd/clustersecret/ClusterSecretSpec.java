package it.aboutbits.clustersecret.crd.clustersecret;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.fabric8.generator.annotation.Required;
import it.aboutbits.clustersecret.selector.NamespaceSelectorTerm;
import lombok.Getter;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@NullMarked
@Getter
@Setter
public class ClusterSecretSpec {
    /// Namespaces to place the Secret in. The terms are ORed; an empty list matches no namespace.
    @JsonProperty("namespaceSelectorTerm")
    @io.fabric8.generator.annotation.Nullable
    private List<NamespaceSelectorTerm> namespaceSelectorTerms = new ArrayList<>();

    /// Template of the Secret to replicate across the namespaces.
    @Required
    private SecretTemplate template = new SecretTemplate();

    /// Secrets whose whole data is loaded first, in list order. Later entries overwrite earlier ones.
    @io.fabric8.generator.annotation.Nullable
    private List<DataFrom> dataFrom = new ArrayList<>();

    /// Data keys loaded from single keys of other Secrets, applied over `dataFrom`.
    @io.fabric8.generator.annotation.Nullable
    private Map<String, DataValueFrom> dataValueFrom = new LinkedHashMap<>();
}
