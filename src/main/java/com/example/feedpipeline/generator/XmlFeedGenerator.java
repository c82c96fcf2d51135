package com.example.feedpipeline.generator;

import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.FeedFormat;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.storage.StorageSink;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;

/**
 * XML 生成器。
 * 结构：feed(type, generated) / metadata / items / item，字段名中的 _ 替换为 -，
 * 多值字段输出为重复的 value 子元素，值为 null 的字段不输出。
 */
@Component
public class XmlFeedGenerator extends AbstractFormatGenerator {

    public XmlFeedGenerator(FieldResolver fieldResolver, StorageSink storageSink) {
        super(fieldResolver, storageSink);
    }

    @Override
    public FeedFormat format() {
        return FeedFormat.XML;
    }

    @Override
    protected Rendered render(FeedDefinition feed, List<String> fields, Iterator<?> records,
            GenerationRecord generation) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        Document document = factory.newDocumentBuilder().newDocument();

        Element root = document.createElement("feed");
        root.setAttribute("type", feed.getFeedType().getCode());
        root.setAttribute("generated", FieldValues.toText(generation.getStartedAt()));
        document.appendChild(root);

        Element metadata = appendChild(document, root, "metadata");
        appendText(document, metadata, "customer", feed.getOwner().displayName());
        appendText(document, metadata, "feed_name", feed.getName());
        appendText(document, metadata, "generation_id", generation.getGenerationId());

        Element items = appendChild(document, root, "items");
        int rowCount = 0;
        while (records.hasNext()) {
            Object record = records.next();
            Element item = appendChild(document, items, "item");

            for (String field : fields) {
                Object value = valueOf(feed, record, field);
                if (value == null) {
                    continue;
                }
                Element fieldElement = appendChild(document, item, field.replace('_', '-'));
                if (value instanceof List) {
                    for (Object member : (List<?>) value) {
                        appendText(document, fieldElement, "value", FieldValues.toXmlText(member));
                    }
                } else {
                    fieldElement.setTextContent(FieldValues.toXmlText(value));
                }
            }
            rowCount++;
        }

        return new Rendered(serialize(document), rowCount);
    }

    private Element appendChild(Document document, Element parent, String name) {
        Element child = document.createElement(name);
        parent.appendChild(child);
        return child;
    }

    private void appendText(Document document, Element parent, String name, String text) {
        appendChild(document, parent, name).setTextContent(FieldValues.toXmlText(text));
    }

    private byte[] serialize(Document document) throws Exception {
        TransformerFactory transformerFactory = TransformerFactory.newInstance();
        transformerFactory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        Transformer transformer = transformerFactory.newTransformer();
        transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        transformer.transform(new DOMSource(document), new StreamResult(buffer));
        return buffer.toByteArray();
    }
}
