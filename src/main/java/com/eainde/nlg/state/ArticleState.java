package com.eainde.nlg.state;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.model.Message;
import com.eainde.nlg.realize.surface.SurfaceFormat;
import com.eainde.nlg.resource.Languages;
import org.bsc.langgraph4j.state.AgentState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * State of one article generation run. Every value is serializable and never null.
 */
public class ArticleState extends AgentState {

    public static final String LANGUAGE = "language";
    public static final String DATASET = "dataset";
    public static final String LOCATION = "location";
    public static final String LOCATION_TYPE = "locationType";
    public static final String PREVIOUS_LOCATION = "previousLocation";
    public static final String SURFACE_FORMAT = "surfaceFormat";
    public static final String RANDOM = "random";
    public static final String CORE = "core";
    public static final String EXPANDED = "expanded";
    public static final String PREVIOUS = "previous";
    public static final String PLAN = "plan";
    public static final String TEXT = "text";

    public ArticleState(Map<String, Object> initData) {
        super(initData);
    }

    /**
     * Inputs of a run.
     *
     * @param language         article language, or its {@code -head} variant for headlines
     * @param previousLocation location of the article read before this one, or empty
     */
    public static Map<String, Object> inputs(String language, String dataset, String location, String locationType,
                                             String previousLocation, SurfaceFormat format, long seed) {
        Map<String, Object> inputs = new HashMap<>();
        inputs.put(LANGUAGE, language);
        inputs.put(DATASET, dataset);
        inputs.put(LOCATION, location);
        inputs.put(LOCATION_TYPE, locationType == null ? "" : locationType);
        inputs.put(PREVIOUS_LOCATION, previousLocation == null ? "" : previousLocation);
        inputs.put(SURFACE_FORMAT, format);
        inputs.put(RANDOM, new Random(seed));
        return inputs;
    }

    public String getLanguage() { return (String) this.data().get(LANGUAGE); }
    public String getDataset() { return (String) this.data().get(DATASET); }
    public String getLocation() { return (String) this.data().get(LOCATION); }
    public String getLocationType() { return (String) this.data().getOrDefault(LOCATION_TYPE, ""); }
    public String getPreviousLocation() { return (String) this.data().getOrDefault(PREVIOUS_LOCATION, ""); }

    public boolean isHeadline() {
        return Languages.isHeadline(getLanguage());
    }

    public SurfaceFormat getSurfaceFormat() {
        return isHeadline() ? SurfaceFormat.HEADLINE
                : (SurfaceFormat) this.data().getOrDefault(SURFACE_FORMAT, SurfaceFormat.BODY);
    }

    /** The run's generator. Nodes that draw from it must hand it back in their update. */
    public Random getRandom() { return (Random) this.data().get(RANDOM); }

    public List<Message> getCore() { return messages(CORE); }
    public List<Message> getExpanded() { return messages(EXPANDED); }
    public List<Message> getPrevious() { return messages(PREVIOUS); }

    /** Core followed by expanded messages, the pool later template rules draw from. */
    public List<Message> getAllMessages() {
        List<Message> all = new ArrayList<>(getCore());
        all.addAll(getExpanded());
        return all;
    }

    public DocumentPlanNode getPlan() {
        DocumentPlanNode plan = (DocumentPlanNode) this.data().get(PLAN);
        if (plan == null) {
            throw new IllegalStateException("No document plan in state");
        }
        return plan;
    }

    public String getText() { return (String) this.data().getOrDefault(TEXT, ""); }

    @SuppressWarnings("unchecked")
    private List<Message> messages(String key) {
        return (List<Message>) this.data().getOrDefault(key, List.of());
    }
}
