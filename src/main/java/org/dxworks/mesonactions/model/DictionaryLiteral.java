package org.dxworks.mesonactions.model;

import java.util.List;

public class DictionaryLiteral extends Node {
    private final List<KeyValueItem> entries;

    public DictionaryLiteral(Location location, List<KeyValueItem> entries) {
        super(location);
        this.entries = adoptAll(entries);
    }

    public List<KeyValueItem> getEntries() {
        return entries;
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitDictionaryLiteral(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        visitAll(entries, visitor);
    }
}
