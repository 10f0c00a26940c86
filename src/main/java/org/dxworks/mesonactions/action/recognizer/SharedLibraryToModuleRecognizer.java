package org.dxworks.mesonactions.action.recognizer;

import org.dxworks.mesonactions.RecognizerKind;
import org.dxworks.mesonactions.index.BuiltinFunctions;

public class SharedLibraryToModuleRecognizer extends TargetConversionRecognizer {

    public SharedLibraryToModuleRecognizer() {
        super(BuiltinFunctions.SHARED_LIBRARY, BuiltinFunctions.SHARED_MODULE);
    }

    @Override
    public RecognizerKind getKind() {
        return RecognizerKind.SHARED_LIBRARY_TO_MODULE;
    }
}
