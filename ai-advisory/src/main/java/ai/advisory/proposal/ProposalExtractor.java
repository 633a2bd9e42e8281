package ai.advisory.proposal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the first brace-delimited JSON object in free-form advisor prose that validates
 * as a {@link TradeProposal}. Objects that are not proposals, such as echoed market
 * metrics, are skipped. Stateless: it never logs, touches
 * history or calls out.
 */
@Component
public class ProposalExtractor {
    private static final JsonMapper LENIENT = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    public Optional<TradeProposal> extract(String replyText) {
        return inspect(replyText).asOptional();
    }

    public Extraction inspect(String replyText) {
        if (replyText == null || replyText.isBlank()) {
            return Extraction.NONE_FOUND;
        }
        List<String> candidates = candidateBlocks(replyText);
        if (candidates.isEmpty()) {
            return Extraction.NONE_FOUND;
        }

        String firstParseError = null;
        String firstRejection = null;
        for (String candidate : candidates) {
            JsonNode node;
            try {
                node = LENIENT.readTree(candidate);
            } catch (JsonProcessingException e) {
                if (firstParseError == null) {
                    firstParseError = e.getOriginalMessage();
                }
                continue;
            }
            if (node == null || !node.isObject()) {
                continue;
            }
            Extraction extraction = ProposalValidator.validate(node);
            if (extraction.kind() == Extraction.Kind.PROPOSAL) {
                return extraction;
            }
            if (firstRejection == null) {
                firstRejection = extraction.reason();
            }
        }
        if (firstRejection != null) {
            return Extraction.invalid(firstRejection);
        }
        return Extraction.invalid("unparsable structured block: " + firstParseError);
    }

    /**
     * Top-level {@code {...}} spans in order of appearance. Braces inside quoted strings do
     * not count; an unterminated block runs to the end of the text. A single quote only
     * opens a string where a JSON value or name may start, so apostrophes in prose are
     * plain text.
     */
    static List<String> candidateBlocks(String text) {
        List<String> blocks = new ArrayList<>();
        int depth = 0;
        int start = -1;
        char quote = 0;
        boolean escaped = false;
        char previous = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (depth == 0) {
                if (c == '{') {
                    depth = 1;
                    start = i;
                    previous = c;
                }
                continue;
            }
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                previous = c;
                continue;
            }
            if (c == '"' || (c == '\'' && opensValue(previous))) {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    blocks.add(text.substring(start, i + 1));
                    start = -1;
                }
            }
            if (!Character.isWhitespace(c)) {
                previous = c;
            }
        }
        if (depth > 0 && start >= 0) {
            blocks.add(text.substring(start));
        }
        return blocks;
    }

    private static boolean opensValue(char previous) {
        return previous == '{' || previous == ':' || previous == ',' || previous == '[';
    }
}
