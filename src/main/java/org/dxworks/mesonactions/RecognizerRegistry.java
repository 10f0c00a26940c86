package org.dxworks.mesonactions;

import org.dxworks.mesonactions.action.recognizer.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public class RecognizerRegistry {

    public static Set<String> allRecognizerNames() {
        return Arrays.stream(RecognizerKind.values())
            .map(RecognizerKind::getName)
            .collect(Collectors.toSet());
    }

    /**
     * Enabled recognizers in {@link RecognizerKind} declaration order.
     */
    public static List<CodeActionRecognizer> buildRecognizers(CodeActionsConfig config) {
        List<CodeActionRecognizer> recognizers = new ArrayList<>();

        for (RecognizerKind kind : RecognizerKind.values()) {
            if (config.isActionEnabled(kind.getName())) {
                recognizers.add(createRecognizer(kind, config));
            }
        }

        return Collections.unmodifiableList(recognizers);
    }

    private static CodeActionRecognizer createRecognizer(RecognizerKind kind, CodeActionsConfig config) {
        return switch (kind) {
            case INTEGER_BASE -> new IntegerBaseRecognizer();
            case COPY_FILE -> new CopyFileRecognizer(config.getCopyFileInstallDefault());
            case DECLARE_DEPENDENCY -> new DeclareDependencyRecognizer(config.getDependencySuffix());
            case LIBRARY_TO_GENERIC -> new LibraryToGenericRecognizer();
            case SHARED_LIBRARY_TO_MODULE -> new SharedLibraryToModuleRecognizer();
            case MODULE_TO_SHARED_LIBRARY -> new ModuleToSharedLibraryRecognizer();
        };
    }
}
