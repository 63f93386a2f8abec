package io.leavesfly.meer.engine.toolcall;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工具调用解析器
 * <p>
 * 语法：
 * <pre>
 * &lt;tool name="read_file" path="src/App.java"/&gt;
 * &lt;tool name="propose_edit" path="a.txt" description="..."&gt;新内容&lt;/tool&gt;
 * </pre>
 * 先按引号感知的方式扫描起始标签的属性，再从起始标签之后查找第一个结束标签截取标签体，
 * 因此属性值中的 '&gt;' 不会提前结束标签。
 * <p>
 * 缺少 name、引号未闭合或起始标签未闭合的标记会被跳过；
 * 找不到结束标签时停止扫描，其后的内容都不会被提取。
 */
@Slf4j
public final class ToolCallParser {

    private static final String START_MARKER = "<tool";
    private static final String END_MARKER = "</tool>";

    private ToolCallParser() {
    }

    public static ParsedResponse parse(String text) {
        if (text == null || text.isEmpty()) {
            return new ParsedResponse("", List.of());
        }

        List<ToolInvocation> invocations = new ArrayList<>();
        int firstStart = -1;
        int cursor = 0;

        while (cursor < text.length()) {
            int start = text.indexOf(START_MARKER, cursor);
            if (start < 0) {
                break;
            }
            int afterMarker = start + START_MARKER.length();
            // 必须是 "<tool" 后跟空白、'/' 或 '>'，排除 "<toolbox" 之类
            if (afterMarker < text.length() && !isTagBoundary(text.charAt(afterMarker))) {
                cursor = afterMarker;
                continue;
            }

            StartTag tag = scanStartTag(text, afterMarker);
            if (tag == null || tag.attributes.get("name") == null || tag.attributes.get("name").isBlank()) {
                log.debug("Skipping malformed tool marker at offset {}", start);
                cursor = afterMarker;
                continue;
            }

            String body;
            int next;
            if (tag.selfClosing) {
                body = "";
                next = tag.end;
            } else {
                int close = text.indexOf(END_MARKER, tag.end);
                if (close < 0) {
                    log.debug("Unterminated tool marker '{}' at offset {}, ignoring the rest",
                            tag.attributes.get("name"), start);
                    break;
                }
                body = text.substring(tag.end, close).trim();
                next = close + END_MARKER.length();
            }

            Map<String, String> params = new LinkedHashMap<>(tag.attributes);
            String toolName = params.remove("name").trim();
            invocations.add(ToolInvocation.builder()
                    .toolName(toolName)
                    .params(params)
                    .body(body)
                    .build());
            if (firstStart < 0) {
                firstStart = start;
            }
            cursor = next;
        }

        String narration = firstStart < 0 ? text.trim() : text.substring(0, firstStart).trim();
        return new ParsedResponse(narration, invocations);
    }

    private static boolean isTagBoundary(char c) {
        return Character.isWhitespace(c) || c == '/' || c == '>';
    }

    /**
     * 扫描起始标签的属性，直到 '&gt;' 或 '/&gt;'
     *
     * @return 标签信息；格式错误时返回 null
     */
    private static StartTag scanStartTag(String text, int from) {
        Map<String, String> attributes = new LinkedHashMap<>();
        int i = from;
        int length = text.length();

        while (i < length) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '>') {
                return new StartTag(attributes, false, i + 1);
            } else if (c == '/') {
                if (i + 1 < length && text.charAt(i + 1) == '>') {
                    return new StartTag(attributes, true, i + 2);
                }
                return null;
            } else if (isNameChar(c)) {
                int nameStart = i;
                while (i < length && isNameChar(text.charAt(i))) {
                    i++;
                }
                String name = text.substring(nameStart, i);
                while (i < length && Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                if (i >= length || text.charAt(i) != '=') {
                    return null;
                }
                i++;
                while (i < length && Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                if (i >= length) {
                    return null;
                }
                char quote = text.charAt(i);
                if (quote != '"' && quote != '\'') {
                    return null;
                }
                int valueEnd = text.indexOf(quote, i + 1);
                if (valueEnd < 0) {
                    return null;
                }
                attributes.put(name, text.substring(i + 1, valueEnd));
                i = valueEnd + 1;
            } else {
                return null;
            }
        }
        return null;
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    private static final class StartTag {
        private final Map<String, String> attributes;
        private final boolean selfClosing;
        private final int end;

        private StartTag(Map<String, String> attributes, boolean selfClosing, int end) {
            this.attributes = attributes;
            this.selfClosing = selfClosing;
            this.end = end;
        }
    }
}
