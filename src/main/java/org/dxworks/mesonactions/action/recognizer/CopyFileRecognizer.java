package org.dxworks.mesonactions.action.recognizer;

import org.dxworks.mesonactions.RecognizerKind;
import org.dxworks.mesonactions.action.ActionProposal;
import org.dxworks.mesonactions.format.SourcePrinter;
import org.dxworks.mesonactions.index.BuiltinFunctions;
import org.dxworks.mesonactions.index.Function;
import org.dxworks.mesonactions.index.ProjectIndex;
import org.dxworks.mesonactions.model.ArgumentList;
import org.dxworks.mesonactions.model.BooleanLiteral;
import org.dxworks.mesonactions.model.FunctionExpression;
import org.dxworks.mesonactions.model.IdExpression;
import org.dxworks.mesonactions.model.KeywordItem;
import org.dxworks.mesonactions.model.Location;
import org.dxworks.mesonactions.model.Node;
import org.dxworks.mesonactions.model.StringLiteral;
import org.eclipse.lsp4j.CodeActionKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Completes a {@code copy_file(source, destination, install: ..., install_dir: ...)} call that is
 * missing its destination or install keywords.
 */
public class CopyFileRecognizer implements CodeActionRecognizer {
    static final String TITLE = "Add missing copy_file arguments";
    private static final Location SYNTHETIC = Location.at(0, 0);

    private final boolean installDefault;

    public CopyFileRecognizer(boolean installDefault) {
        this.installDefault = installDefault;
    }

    @Override
    public RecognizerKind getKind() {
        return RecognizerKind.COPY_FILE;
    }

    @Override
    public List<ActionProposal> recognize(FunctionExpression call, Function function, ProjectIndex index) {
        if (!BuiltinFunctions.COPY_FILE.equals(function.id())) {
            return List.of();
        }
        ArgumentList args = call.getArgs();
        if (expectedArgsForCopyFile(args)) {
            return List.of();
        }
        List<Node> positional = args.getPositionalArgs();
        if (positional.isEmpty() || positional.size() > 2) {
            return List.of();
        }

        Optional<String> destination = positional.size() == 1
                ? defaultDestination(positional.get(0))
                : Optional.empty();
        List<Node> appended = new ArrayList<>();
        Optional<Node> install = args.getKwarg("install");
        boolean installs;
        if (install.isPresent()) {
            installs = isTrue(install.get());
        } else {
            appended.add(keyword("install", new BooleanLiteral(SYNTHETIC, installDefault)));
            installs = installDefault;
        }
        if (installs && args.getKwarg("install_dir").isEmpty()) {
            appended.add(keyword("install_dir", defaultInstallDir()));
        }
        if (destination.isEmpty() && appended.isEmpty()) {
            return List.of();
        }

        // existing arguments stay as written; new ones are inserted after them
        List<ActionProposal.Replacement> insertions = new ArrayList<>();
        Location argsEnd = args.getLocation().endPoint();
        if (destination.isPresent()) {
            StringLiteral literal = new StringLiteral(SYNTHETIC, destination.get(), false);
            Location sourceEnd = positional.get(0).getLocation().endPoint();
            if (sourceEnd.equals(argsEnd)) {
                appended.add(0, literal);
            } else {
                insertions.add(new ActionProposal.Replacement(sourceEnd, ", " + SourcePrinter.print(literal)));
            }
        }
        if (!appended.isEmpty()) {
            insertions.add(new ActionProposal.Replacement(argsEnd, ", " + SourcePrinter.printArguments(appended)));
        }
        return List.of(new ActionProposal(TITLE, CodeActionKind.QuickFix, insertions));
    }

    /**
     * Source and destination given, {@code install} given, and {@code install_dir} given whenever
     * {@code install} is literally true.
     */
    static boolean expectedArgsForCopyFile(ArgumentList al) {
        if (al.getPositionalArgs().size() != 2) {
            return false;
        }
        Optional<Node> install = al.getKwarg("install");
        if (install.isEmpty()) {
            return false;
        }
        return !isTrue(install.get()) || al.getKwarg("install_dir").isPresent();
    }

    private static boolean isTrue(Node node) {
        return node instanceof BooleanLiteral literal && literal.getValue();
    }

    private static KeywordItem keyword(String name, Node value) {
        return new KeywordItem(SYNTHETIC, new IdExpression(SYNTHETIC, name), value);
    }

    // get_option('datadir')
    private static Node defaultInstallDir() {
        return new FunctionExpression(SYNTHETIC, new IdExpression(SYNTHETIC, "get_option"),
                new ArgumentList(SYNTHETIC, List.of(new StringLiteral(SYNTHETIC, "datadir", false))));
    }

    // meson copies to the source's file name when no destination is given
    private static Optional<String> defaultDestination(Node source) {
        if (!(source instanceof StringLiteral literal) || literal.isFormat()) {
            return Optional.empty();
        }
        String path = literal.getValue();
        String name = path.substring(path.lastIndexOf('/') + 1);
        return name.isEmpty() ? Optional.empty() : Optional.of(name);
    }
}
