package org.dxworks.mesonactions.action;

import org.dxworks.mesonactions.model.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What a recognizer wants to change, before it is tied to a document. Replacements must not
 * overlap.
 */
public class ActionProposal {
    private final String title;
    private final String kind;
    private final List<Replacement> replacements;

    public ActionProposal(String title, String kind, List<Replacement> replacements) {
        if (replacements.isEmpty()) {
            throw new IllegalArgumentException("Proposal '" + title + "' has no replacements");
        }
        this.title = Objects.requireNonNull(title, "title");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.replacements = Collections.unmodifiableList(new ArrayList<>(replacements));
    }

    public static ActionProposal replace(String title, String kind, Location location, String newText) {
        return new ActionProposal(title, kind, List.of(new Replacement(location, newText)));
    }

    public String getTitle() {
        return title;
    }

    public String getKind() {
        return kind;
    }

    public List<Replacement> getReplacements() {
        return replacements;
    }

    public static class Replacement {
        private final Location location;
        private final String newText;

        public Replacement(Location location, String newText) {
            this.location = Objects.requireNonNull(location, "location");
            this.newText = Objects.requireNonNull(newText, "newText");
        }

        public Location getLocation() {
            return location;
        }

        public String getNewText() {
            return newText;
        }
    }
}
