package com.partinspect.render.config;

import com.google.gson.annotations.SerializedName;
import com.partinspect.engine.InspectConfig;

import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of an inspection settings file. Every field is optional.
 *
 * {
 *   "style": "html",
 *   "root_name": "part",
 *   "max_depth": 3,
 *   "max_items": 10,
 *   "scalar_types": ["java.util.Locale"],
 *   "masked_name_fragment": "password"
 * }
 */
public class RenderConfig {

    @SerializedName("style")
    private String style;

    @SerializedName("root_name")
    private String rootName;

    /** Levels of children to expand (default: 2). */
    @SerializedName("max_depth")
    private Integer maxDepth;

    /** Entries expanded per collection (default: 5). */
    @SerializedName("max_items")
    private Integer maxItems;

    /** Fully qualified class names shown as scalars. */
    @SerializedName("scalar_types")
    private List<String> scalarTypes;

    @SerializedName("masked_name_fragment")
    private String maskedNameFragment;

    public static RenderConfig defaults() {
        return new RenderConfig();
    }

    public String getStyle()          { return style != null ? style : "text"; }
    public String getRootName()       { return rootName != null ? rootName : "root"; }
    public int getMaxDepth()          { return maxDepth != null ? maxDepth : InspectConfig.defaults().maxDepth; }
    public int getMaxItems()          { return maxItems != null ? maxItems : InspectConfig.defaults().maxItems; }
    public List<String> getScalarTypes() { return scalarTypes != null ? scalarTypes : Collections.emptyList(); }
    public String getMaskedNameFragment() {
        return maskedNameFragment != null ? maskedNameFragment : InspectConfig.defaults().maskedNameFragment;
    }

    /**
     * Builds the engine configuration, loading scalar types with this class's loader.
     *
     * @throws IllegalArgumentException if a scalar type cannot be loaded or a budget is negative
     */
    public InspectConfig toInspectConfig() {
        InspectConfig config = new InspectConfig(getMaxDepth(), getMaxItems())
            .withMaskedNameFragment(getMaskedNameFragment());
        for (String typeName : getScalarTypes()) {
            try {
                config = config.withScalarType(Class.forName(typeName.trim()));
            } catch (ClassNotFoundException e) {
                throw new IllegalArgumentException("Unknown scalar type: " + typeName, e);
            }
        }
        return config;
    }
}
