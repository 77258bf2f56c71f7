package build.tokenbuddy.test.source;

import build.tokenbuddy.Diagnostic;
import build.tokenbuddy.Json;
import build.tokenbuddy.source.FileKind;
import build.tokenbuddy.source.SchemaValidator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class SchemaValidatorTest {

    @Test
    public void can_accept_valid_token_document() {
        assertThat(SchemaValidator.structural().validate(Json.parse("""
                {
                  "color": {
                    "$type": "color",
                    "primary": { "$value": "#000000", "$description": "Text" }
                  }
                }
                """), FileKind.TOKENS)).isEmpty();
    }

    @Test
    public void can_report_structural_problems() {
        List<Diagnostic> diagnostics = SchemaValidator.structural().validate(Json.parse("""
                {
                  "color": {
                    "$type": 1,
                    "primary": { "$value": "#000000", "$description": false },
                    "typed": { "$type": "color" },
                    "extended": { "$value": 1, "$extensions": "vendor" }
                  }
                }
                """), FileKind.TOKENS);
        assertThat(diagnostics).containsExactly(
                new Diagnostic("color", "$type must be a string"),
                new Diagnostic("color.primary", "$description must be a string"),
                new Diagnostic("color.typed", "Token is missing $value"),
                new Diagnostic("color.extended", "$extensions must be an object"));
    }

    @Test
    public void can_reject_non_object_document() {
        assertThat(SchemaValidator.structural().validate(List.of(), FileKind.UNKNOWN))
                .containsExactly(new Diagnostic("", "Document must be a JSON object"));
        assertThat(SchemaValidator.none().validate(List.of(), FileKind.UNKNOWN)).isEmpty();
    }
}
