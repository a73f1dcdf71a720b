package ai.docsite.resume.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * YAML form of {@link Document}, the human-editable side of the converter.
 */
public class DocumentYaml {

    private final ObjectMapper mapper;

    public DocumentYaml() {
        this.mapper = YamlMappers.create();
    }

    public String write(Document document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new ResumeConversionException("Failed to serialize document", ex);
        }
    }

    public Document read(String yaml) {
        try {
            return mapper.readValue(yaml, Document.class);
        } catch (JsonProcessingException ex) {
            throw new ResumeConversionException("Invalid document YAML: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Tree form of the document exactly as it would be serialized, used for structural comparison.
     */
    public JsonNode toTree(Document document) {
        return mapper.valueToTree(document);
    }
}
