package org.literalscan.astvisitor;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.literalscan.astnode.Node;
import org.literalscan.astnode.NumberNode;
import org.literalscan.astnode.RegexReplaceNode;
import org.literalscan.astnode.StringNode;

/**
 * Converts a literal node tree into fastjson2 objects.
 */
public class JsonVisitor implements Visitor {
    private JSONObject result;

    public static String toJson(Node node, boolean pretty) {
        JsonVisitor visitor = new JsonVisitor();
        node.accept(visitor);
        JSONWriter.Feature[] features = pretty ? new JSONWriter.Feature[]{JSONWriter.Feature.PrettyFormat} : new JSONWriter.Feature[0];
        return JSON.toJSONString(visitor.getResult(), features);
    }

    public JSONObject getResult() {
        return result;
    }

    private static JSONObject base(String type, Node node) {
        JSONObject json = new JSONObject();
        json.put("type", type);
        json.put("start", node.getStart());
        json.put("end", node.getEnd());
        return json;
    }

    @Override
    public void visit(StringNode node) {
        JSONObject json = base("string", node);
        json.put("value", node.getValue());
        result = json;
    }

    @Override
    public void visit(NumberNode node) {
        JSONObject json = base("number", node);
        json.put("kind", node.kind.name().toLowerCase());
        json.put("value", node.getValue());
        result = json;
    }

    @Override
    public void visit(RegexReplaceNode node) {
        JSONObject json = base("regexp-replace", node);
        node.pattern.accept(this);
        json.put("pattern", result);
        node.replacement.accept(this);
        json.put("replacement", result);
        result = json;
    }
}
