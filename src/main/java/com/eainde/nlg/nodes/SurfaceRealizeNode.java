package com.eainde.nlg.nodes;

import com.eainde.nlg.realize.surface.SurfaceRealizer;
import com.eainde.nlg.state.ArticleState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
public class SurfaceRealizeNode extends ArticleStageNode {

    private final SurfaceRealizer surfaceRealizer;

    public SurfaceRealizeNode(SurfaceRealizer surfaceRealizer) {
        this.surfaceRealizer = surfaceRealizer;
    }

    @Override
    protected String stageName() {
        return "surface_realize";
    }

    @Override
    protected Map<String, Object> process(ArticleState state) {
        String text = surfaceRealizer.realize(state.getPlan(), state.getSurfaceFormat());
        log.debug("Realized {} text: {}", state.getSurfaceFormat(), text);
        return Map.of(ArticleState.TEXT, text);
    }
}
