package org.dxworks.mesonactions.action.recognizer;

import org.dxworks.mesonactions.RecognizerKind;
import org.dxworks.mesonactions.action.ActionProposal;
import org.dxworks.mesonactions.model.IntegerLiteral;
import org.eclipse.lsp4j.CodeActionKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offers to rewrite an integer literal in each base it is not already written in.
 */
public class IntegerBaseRecognizer implements CodeActionRecognizer {
    private static final String HEX_PREFIX = "0x";
    private static final String OCTAL_PREFIX = "0o";
    private static final String BINARY_PREFIX = "0b";

    @Override
    public RecognizerKind getKind() {
        return RecognizerKind.INTEGER_BASE;
    }

    @Override
    public List<ActionProposal> recognize(IntegerLiteral literal) {
        long value = literal.getValue();
        if (value < 0) {
            return List.of();
        }
        String text = literal.getText().toLowerCase(Locale.ROOT);
        boolean hex = text.startsWith(HEX_PREFIX);
        boolean octal = text.startsWith(OCTAL_PREFIX);
        boolean binary = text.startsWith(BINARY_PREFIX);

        List<ActionProposal> proposals = new ArrayList<>();
        if (!hex) {
            proposals.add(makeActionForBase(literal, "Convert to hexadecimal literal", HEX_PREFIX,
                    Long.toString(value, 16)));
        }
        if (!octal) {
            proposals.add(makeActionForBase(literal, "Convert to octal literal", OCTAL_PREFIX,
                    Long.toString(value, 8)));
        }
        if (!binary) {
            proposals.add(makeActionForBase(literal, "Convert to binary literal", BINARY_PREFIX,
                    Long.toString(value, 2)));
        }
        if (hex || octal || binary) {
            proposals.add(makeActionForBase(literal, "Convert to decimal literal", "", Long.toString(value)));
        }
        return proposals;
    }

    private static ActionProposal makeActionForBase(IntegerLiteral literal, String title, String prefix, String digits) {
        return ActionProposal.replace(title, CodeActionKind.RefactorRewrite, literal.getLocation(), prefix + digits);
    }
}
