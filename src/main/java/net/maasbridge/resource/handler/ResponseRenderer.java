package net.maasbridge.resource.handler;

import java.util.Collection;
import lombok.extern.slf4j.Slf4j;
import net.maasbridge.util.LoggingUtils;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.ObjectWriter;
import tools.jackson.dataformat.xml.XmlMapper;

/**
 * Serializes validated payloads for the response envelope.
 *
 * <p>XML lists are wrapped as {@code <root><item>..</item></root>}. A payload that cannot be
 * written as XML falls back to JSON so the caller still gets data.
 */
@Slf4j
@Component
public class ResponseRenderer {

    static final String LIST_ITEM_ELEMENT = "item";

    private final ObjectMapper jsonMapper;
    private final XmlMapper xmlMapper;

    public ResponseRenderer(ObjectMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
        this.xmlMapper = new XmlMapper();
    }

    public RenderedBody render(Object payload, ResponseFormat format, String rootName) {
        if (format == ResponseFormat.XML) {
            try {
                return new RenderedBody(toXml(payload, rootName), ResponseFormat.XML.mimeType());
            } catch (JacksonException e) {
                LoggingUtils.warn(log, e, "XML rendering failed for {}; falling back to JSON", rootName);
            }
        }
        return new RenderedBody(jsonMapper.writeValueAsString(payload), ResponseFormat.JSON.mimeType());
    }

    private String toXml(Object payload, String rootName) {
        if (payload instanceof Collection<?> items) {
            ObjectWriter itemWriter = xmlMapper.writer().withRootName(LIST_ITEM_ELEMENT);
            StringBuilder xml = new StringBuilder("<").append(rootName).append('>');
            for (Object item : items) {
                xml.append(itemWriter.writeValueAsString(item));
            }
            return xml.append("</").append(rootName).append('>').toString();
        }
        return xmlMapper.writer().withRootName(rootName).writeValueAsString(payload);
    }

    /**
     * Serialized payload plus the media type it was written in.
     */
    public record RenderedBody(String text, String mimeType) {
    }
}
