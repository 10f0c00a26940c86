package org.dxworks.mesonactions;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.dxworks.mesonactions.model.BuildDefinition;
import org.dxworks.mesonactions.support.MesonTestParser;
import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

public class TestUtils {
    public static final String URI = "file:///project/meson.build";

    public static final ObjectMapper APPROVAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    public static Range range(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    public static Range cursor(int line, int character) {
        return range(line, character, line, character);
    }

    /** Range covering the whole of a single-line source. */
    public static Range wholeLine(String source) {
        return range(0, 0, 0, source.length());
    }

    public static List<CodeAction> collect(String source, Range range) {
        return collect(CodeActions.withDefaults(), source, range);
    }

    public static List<CodeAction> collect(CodeActions codeActions, String source, Range range) {
        BuildDefinition root = MesonTestParser.parse(source);
        return codeActions.collectCodeActions(range, URI, codeActions.builtinIndex(), root);
    }

    public static List<String> titles(List<CodeAction> actions) {
        return actions.stream().map(CodeAction::getTitle).collect(Collectors.toList());
    }

    public static CodeAction find(List<CodeAction> actions, String title) {
        return actions.stream()
                .filter(action -> action.getTitle().equals(title))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No action '" + title + "' in " + titles(actions)));
    }

    public static List<TextEdit> edits(CodeAction action) {
        return action.getEdit().getChanges().get(URI);
    }

    /** Applies the edits of an action to the source it was computed for. */
    public static String apply(String source, CodeAction action) {
        List<TextEdit> sorted = new ArrayList<>(edits(action));
        sorted.sort(Comparator.comparingInt((TextEdit e) -> offset(source, e.getRange().getStart())).reversed());
        StringBuilder result = new StringBuilder(source);
        for (TextEdit edit : sorted) {
            int start = offset(source, edit.getRange().getStart());
            int end = offset(source, edit.getRange().getEnd());
            result.replace(start, end, edit.getNewText());
        }
        return result.toString();
    }

    private static int offset(String source, Position position) {
        int line = 0;
        int index = 0;
        while (line < position.getLine()) {
            index = source.indexOf('\n', index) + 1;
            if (index == 0) {
                throw new IllegalArgumentException("No line " + position.getLine());
            }
            line++;
        }
        return index + position.getCharacter();
    }
}
