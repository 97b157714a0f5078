package com.example.excelsplit.service.excel;

import lombok.extern.slf4j.Slf4j;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * 基于 StAX 的通用 XML 部件扫描器。
 * <p>
 * 调用方按元素本地名注册规则（开始标签、文本内容、结束标签），扫描器负责维护元素栈，
 * 各部件解析器不再各自维护 in_xxx 状态位。命名空间前缀一律忽略，只比较本地名。
 */
@Slf4j
public final class XmlPartScanner {

    private static final XMLInputFactory FACTORY = createFactory();

    private final String partName;
    private final Map<String, List<Consumer<XmlElement>>> startRules = new HashMap<>();
    private final Map<String, List<BiConsumer<XmlElement, String>>> textRules = new HashMap<>();
    private final Map<String, List<Consumer<XmlElement>>> endRules = new HashMap<>();

    private XmlPartScanner(String partName) {
        this.partName = partName;
    }

    public static XmlPartScanner forPart(String partName) {
        return new XmlPartScanner(partName);
    }

    public XmlPartScanner onStart(String localName, Consumer<XmlElement> rule) {
        startRules.computeIfAbsent(localName, k -> new ArrayList<>()).add(rule);
        return this;
    }

    public XmlPartScanner onText(String localName, BiConsumer<XmlElement, String> rule) {
        textRules.computeIfAbsent(localName, k -> new ArrayList<>()).add(rule);
        return this;
    }

    public XmlPartScanner onEnd(String localName, Consumer<XmlElement> rule) {
        endRules.computeIfAbsent(localName, k -> new ArrayList<>()).add(rule);
        return this;
    }

    public void scan(byte[] xml) {
        if (xml == null || xml.length == 0) {
            return;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        XMLStreamReader reader = null;
        try {
            reader = FACTORY.createXMLStreamReader(new ByteArrayInputStream(xml));
            while (reader.hasNext()) {
                int event = reader.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT -> {
                        XmlElement element = new XmlElement(reader.getLocalName(), readAttributes(reader),
                                ancestorsOf(stack));
                        boolean wantsText = textRules.containsKey(element.name());
                        stack.push(new Frame(element, wantsText ? new StringBuilder() : null));
                        fire(startRules, element);
                    }
                    case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA,
                            XMLStreamConstants.SPACE -> {
                        Frame top = stack.peek();
                        if (top != null && top.text() != null) {
                            top.text().append(reader.getText());
                        }
                    }
                    case XMLStreamConstants.END_ELEMENT -> {
                        Frame frame = stack.pop();
                        if (frame.text() != null) {
                            String text = frame.text().toString().trim();
                            for (BiConsumer<XmlElement, String> rule : textRules.get(frame.element().name())) {
                                rule.accept(frame.element(), text);
                            }
                        }
                        fire(endRules, frame.element());
                    }
                    default -> {
                    }
                }
            }
        } catch (XMLStreamException e) {
            throw new ExcelParseException(partName + " XML 解析错误: " + e.getMessage(), e);
        } finally {
            if (reader != null) {
                try {
                    reader.close();
                } catch (XMLStreamException e) {
                    log.debug("关闭 {} 读取器失败: {}", partName, e.getMessage());
                }
            }
        }
    }

    private void fire(Map<String, List<Consumer<XmlElement>>> rules, XmlElement element) {
        List<Consumer<XmlElement>> matched = rules.get(element.name());
        if (matched == null) {
            return;
        }
        for (Consumer<XmlElement> rule : matched) {
            rule.accept(element);
        }
    }

    private static Map<String, String> readAttributes(XMLStreamReader reader) {
        int count = reader.getAttributeCount();
        if (count == 0) {
            return Map.of();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
        }
        return attributes;
    }

    private static List<String> ancestorsOf(Deque<Frame> stack) {
        if (stack.isEmpty()) {
            return List.of();
        }
        List<String> names = new ArrayList<>(stack.size());
        // 栈顶是直接父元素，这里按由近及远的顺序保存
        for (Frame frame : stack) {
            names.add(frame.element().name());
        }
        return names;
    }

    private static XMLInputFactory createFactory() {
        XMLInputFactory factory = XMLInputFactory.newInstance();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        return factory;
    }

    private record Frame(XmlElement element, StringBuilder text) {
    }

    /**
     * 扫描到的元素快照：本地名、按本地名索引的属性、由近及远的祖先本地名。
     */
    public record XmlElement(String name, Map<String, String> attributes, List<String> ancestors) {

        public String attribute(String localName) {
            return attributes.get(localName);
        }

        public Integer intAttribute(String localName) {
            String value = attributes.get(localName);
            if (value == null || value.isBlank()) {
                return null;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }

        public Double doubleAttribute(String localName) {
            String value = attributes.get(localName);
            if (value == null || value.isBlank()) {
                return null;
            }
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }

        public boolean hasParent(String localName) {
            return !ancestors.isEmpty() && ancestors.get(0).equals(localName);
        }

        public boolean within(String localName) {
            return ancestors.contains(localName);
        }
    }
}
