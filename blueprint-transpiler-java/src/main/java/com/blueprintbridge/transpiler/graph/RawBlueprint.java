package com.blueprintbridge.transpiler.graph;

import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs matching the Blueprint JSON export.
 * Field names use @SerializedName for the export's PascalCase keys.
 * Nested arrays stay as raw JsonElements so each node and pin is decoded on its own.
 */
public final class RawBlueprint {

    private RawBlueprint() {}

    public static class RawVariable {
        @SerializedName("VarName")       public String varName;
        @SerializedName("VarType")       public JsonElement varType;   // "float" or {"PinCategory": "float"}
        @SerializedName("Category")      public String category;
        @SerializedName("DefaultValue")  public String defaultValue;
        @SerializedName("PropertyFlags") public List<String> propertyFlags;
        @SerializedName("Tooltip")       public String tooltip;
    }

    public static class RawGraph {
        @SerializedName("GraphName") public String graphName;
        @SerializedName("GraphType") public String graphType;
        @SerializedName("Nodes")     public List<JsonElement> nodes;
    }

    public static class RawNode {
        @SerializedName("NodeGuid")     public String nodeGuid;
        @SerializedName("NodeClass")    public String nodeClass;
        @SerializedName("NodeType")     public String nodeType;      // legacy key for NodeClass
        @SerializedName("Name")         public String name;
        @SerializedName("NodeComment")  public String nodeComment;
        @SerializedName("MemberParent") public String memberParent;
        @SerializedName("MemberName")   public String memberName;
        @SerializedName("Pins")         public List<JsonElement> pins;
        @SerializedName("NodePosX")     public JsonElement nodePosX;  // number, or a numeric string
        @SerializedName("NodePosY")     public JsonElement nodePosY;
    }

    public static class RawPin {
        @SerializedName("PinName")      public String pinName;
        @SerializedName("PinType")      public RawPinType pinType;
        @SerializedName("Direction")    public String direction;
        @SerializedName("LinkedTo")     public List<String> linkedTo;
        @SerializedName("DefaultValue") public String defaultValue;
    }

    public static class RawPinType {
        @SerializedName("PinCategory")          public String pinCategory;
        @SerializedName("PinSubCategoryObject") public String pinSubCategoryObject;
    }
}
