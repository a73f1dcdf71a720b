package ai.docsite.resume.generate;

import ai.docsite.resume.model.ContactOverride;
import ai.docsite.resume.model.ResumeConversionException;
import ai.docsite.resume.model.YamlMappers;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contact details shared by every generated résumé: the fields shown by default and the value of each field.
 */
public record ContactProfile(List<String> contactSelection, Map<String, String> contactRegistry) {

    static final String DEFAULT_PROFILE_RESOURCE = "profile/default-profile.yaml";

    public ContactProfile {
        contactSelection = contactSelection == null ? List.of() : List.copyOf(contactSelection);
        contactRegistry = contactRegistry == null ? Map.of() : Map.copyOf(contactRegistry);
    }

    /**
     * Applies a document's override: its selection replaces the profile's, its registry entries win per field.
     */
    public ContactProfile withOverride(ContactOverride override) {
        if (override == null) {
            return this;
        }
        Map<String, String> registry = new LinkedHashMap<>(contactRegistry);
        if (override.registry() != null) {
            registry.putAll(override.registry());
        }
        List<String> selection = override.selection() != null ? override.selection() : contactSelection;
        return new ContactProfile(selection, registry);
    }

    public static ContactProfile load(Path file) {
        try (InputStream stream = Files.newInputStream(file)) {
            return YamlMappers.create().readValue(stream, ContactProfile.class);
        } catch (IOException ex) {
            throw new ResumeConversionException("Failed to read contact profile " + file, ex);
        }
    }

    public static ContactProfile loadDefault() {
        try (InputStream stream = ContactProfile.class.getClassLoader().getResourceAsStream(DEFAULT_PROFILE_RESOURCE)) {
            if (stream == null) {
                throw new ResumeConversionException("Missing classpath resource " + DEFAULT_PROFILE_RESOURCE, null);
            }
            return YamlMappers.create().readValue(stream, ContactProfile.class);
        } catch (IOException ex) {
            throw new ResumeConversionException("Failed to read default contact profile", ex);
        }
    }
}
