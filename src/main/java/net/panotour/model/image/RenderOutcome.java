package net.panotour.model.image;

import java.util.List;

/**
 * Rendered derivatives in label order plus the advisory warnings raised while rendering.
 */
public record RenderOutcome(List<RenderedAsset> assets, List<String> warnings) {

    public RenderOutcome {
        assets = List.copyOf(assets);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
