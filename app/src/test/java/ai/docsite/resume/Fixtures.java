package ai.docsite.resume;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads test documents from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    public static final String SAMPLE_RESUME = "sample_resume.tex";

    private Fixtures() {
    }

    public static String read(String name) {
        try (InputStream stream = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + name)) {
            if (stream == null) {
                throw new IllegalStateException("Missing fixture " + name);
            }
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
