package org.dxworks.sasframe.rules;

import org.dxworks.sasframe.construct.Construct;
import org.dxworks.sasframe.construct.ConstructKind;
import org.junit.jupiter.api.Test;

import static org.dxworks.sasframe.TestUtils.first;
import static org.dxworks.sasframe.TestUtils.tree;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TemplatesTest {

    private final Construct merge = first(tree("data m;\n  merge left right;\nrun;\n"), ConstructKind.MERGE_STATEMENT);

    @Test
    void render_JoinsListsAndKeepsUnknownPlaceholders() {
        assertEquals("MERGE_STATEMENT of LEFT, RIGHT at line 2 {nothing}",
                Templates.render("{kind} of {inputDatasets} at line {line} {nothing}", merge));
    }

    @Test
    void render_NullAndPlainTemplates() {
        assertNull(Templates.render(null, merge));
        assertEquals("no placeholders", Templates.render("no placeholders", merge));
    }

    @Test
    void solePlaceholder_OnlyForExactTemplates() {
        assertEquals("inputDatasets", Templates.solePlaceholder("{inputDatasets}"));
        assertNull(Templates.solePlaceholder("in: {inputDatasets}"));
        assertEquals("merge left right", Templates.valueOf("text", merge));
        assertEquals(2, Templates.valueOf("inputCount", merge));
    }
}
