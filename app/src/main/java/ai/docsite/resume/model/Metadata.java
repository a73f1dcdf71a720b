package ai.docsite.resume.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Preamble declarations of a résumé.
 *
 * @param name the {@code \myname} declaration
 * @param date the {@code \mydate} declaration
 * @param brand the headline under the name
 * @param professionalProfile the multi-line summary
 * @param colors color roles in declaration order
 * @param setlengths {@code \setlength} declarations keyed by length name without backslash
 * @param deflens {@code \deflen} declarations
 * @param customPackages package and font declarations outside the standard set, verbatim
 * @param fields every other {@code \renewcommand} declaration
 * @param customContactInfo per-document contact override; never produced by the parser
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Metadata(DualField name,
                       DualField date,
                       DualField brand,
                       DualField professionalProfile,
                       Map<String, String> colors,
                       Map<String, String> setlengths,
                       Map<String, String> deflens,
                       String hlcolor,
                       Integer nlinesPp,
                       Boolean listTitleAfterName,
                       List<String> customPackages,
                       Map<String, String> fields,
                       ContactOverride customContactInfo) {

    public Metadata {
        colors = colors == null ? new LinkedHashMap<>() : colors;
        setlengths = setlengths == null ? new LinkedHashMap<>() : setlengths;
        deflens = deflens == null ? new LinkedHashMap<>() : deflens;
        fields = fields == null ? new LinkedHashMap<>() : fields;
        listTitleAfterName = listTitleAfterName == null ? Boolean.TRUE : listTitleAfterName;
    }

    public Metadata withCustomContactInfo(ContactOverride override) {
        return new Metadata(name, date, brand, professionalProfile, colors, setlengths, deflens, hlcolor, nlinesPp,
                listTitleAfterName, customPackages, fields, override);
    }
}
