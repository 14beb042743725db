package ai.pkgedit.manifest;

import ai.pkgedit.model.ProductType;
import com.google.common.collect.ImmutableList;
import java.util.List;

public record ProductDescription(String name, ProductType type, List<String> targets) {

    public ProductDescription {
        targets = ImmutableList.copyOf(targets);
    }
}
