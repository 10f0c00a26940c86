package org.dxworks.mesonactions.action.recognizer;

import org.dxworks.mesonactions.CodeActions;
import org.dxworks.mesonactions.CodeActionsConfig;
import org.dxworks.mesonactions.support.MesonTestParser;
import org.dxworks.mesonactions.support.Nodes;
import org.dxworks.mesonactions.model.ArgumentList;
import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.CodeActionKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.dxworks.mesonactions.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class CopyFileRecognizerTest {
    private static final String TITLE = "Add missing copy_file arguments";

    @Test
    void addsInstallFalseByDefault() {
        String source = "copy_file('a', 'b')";
        List<CodeAction> actions = collect(source, wholeLine(source));

        assertEquals(List.of(TITLE), titles(actions));
        CodeAction action = actions.get(0);
        assertEquals(CodeActionKind.QuickFix, action.getKind());
        assertEquals(range(0, 18, 0, 18), edits(action).get(0).getRange());
        assertEquals(", install: false", edits(action).get(0).getNewText());
        assertEquals("copy_file('a', 'b', install: false)", apply(source, action));
    }

    @Test
    void addsInstallDirWhenInstalling() {
        String source = "copy_file('a', 'b', install: true)";

        CodeAction action = find(collect(source, wholeLine(source)), TITLE);

        assertEquals("copy_file('a', 'b', install: true, install_dir: get_option('datadir'))", apply(source, action));
    }

    @Test
    void derivesDestinationFromSourceName() {
        String source = "copy_file('data/config.ini')";

        CodeAction action = find(collect(source, wholeLine(source)), TITLE);

        assertEquals("copy_file('data/config.ini', 'config.ini', install: false)", apply(source, action));
    }

    @Test
    void insertsDestinationBeforeKeywords() {
        String source = "copy_file('data/x.ini', install: true)";

        CodeAction action = find(collect(source, wholeLine(source)), TITLE);

        assertEquals(2, edits(action).size());
        assertEquals("copy_file('data/x.ini', 'x.ini', install: true, install_dir: get_option('datadir'))",
                apply(source, action));
    }

    @Test
    void keepsLayoutAndComments() {
        String source = "copy_file('a', # src\n  'b')";

        CodeAction action = find(collect(source, range(0, 0, 1, 6)), TITLE);

        assertEquals("copy_file('a', # src\n  'b', install: false)", apply(source, action));
    }

    @Test
    void keepsExistingKeywords() {
        String source = "copy_file('a', 'b', install_mode: 'rw-r--r--', install: true)";

        CodeAction action = find(collect(source, wholeLine(source)), TITLE);

        assertEquals("copy_file('a', 'b', install_mode: 'rw-r--r--', install: true, "
                + "install_dir: get_option('datadir'))", apply(source, action));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "copy_file('a', 'b', install: false)",
            "copy_file('a', 'b', install: true, install_dir: 'share')",
            "copy_file('a', 'b', install: get_option('x'))",
            "copy_file('a', 'b', 'c')",
            "copy_file()",
            "copy_file(src, install: false)"
    })
    void offersNothingWhenNothingCanBeAdded(String source) {
        assertTrue(collect(source, wholeLine(source)).isEmpty(), source);
    }

    @Test
    void usesConfiguredInstallDefault() {
        CodeActions codeActions = new CodeActions(CodeActionsConfig.with(Set.of(), "_dep", true, Map.of()));
        String source = "copy_file('a', 'b')";

        CodeAction action = find(collect(codeActions, source, wholeLine(source)), TITLE);

        assertEquals("copy_file('a', 'b', install: true, install_dir: get_option('datadir'))", apply(source, action));
    }

    @Test
    void recognizesAliasedCalls() {
        CodeActions codeActions = new CodeActions(
                CodeActionsConfig.with(Set.of(), "_dep", false, Map.of("copyfile", "copy_file")));
        String source = "copyfile('a', 'b')";

        CodeAction action = find(collect(codeActions, source, wholeLine(source)), TITLE);

        assertEquals("copyfile('a', 'b', install: false)", apply(source, action));
    }

    @Test
    void checksExpectedArguments() {
        assertTrue(CopyFileRecognizer.expectedArgsForCopyFile(argsOf("copy_file('a', 'b', install: false)")));
        assertTrue(CopyFileRecognizer.expectedArgsForCopyFile(
                argsOf("copy_file('a', 'b', install: true, install_dir: 'x')")));
        assertFalse(CopyFileRecognizer.expectedArgsForCopyFile(argsOf("copy_file('a', 'b', install: true)")));
        assertFalse(CopyFileRecognizer.expectedArgsForCopyFile(argsOf("copy_file('a', install: false)")));
        assertFalse(CopyFileRecognizer.expectedArgsForCopyFile(argsOf("copy_file('a', 'b')")));
    }

    private static ArgumentList argsOf(String source) {
        return Nodes.first(MesonTestParser.parse(source), ArgumentList.class);
    }
}
