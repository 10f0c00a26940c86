package org.dxworks.mesonactions.action.recognizer;

import org.dxworks.mesonactions.RecognizerKind;
import org.dxworks.mesonactions.index.BuiltinFunctions;

public class ModuleToSharedLibraryRecognizer extends TargetConversionRecognizer {

    public ModuleToSharedLibraryRecognizer() {
        super(BuiltinFunctions.SHARED_MODULE, BuiltinFunctions.SHARED_LIBRARY);
    }

    @Override
    public RecognizerKind getKind() {
        return RecognizerKind.MODULE_TO_SHARED_LIBRARY;
    }
}
