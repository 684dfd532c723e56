package org.pragmatica.cop;

import org.junit.jupiter.api.Test;
import org.pragmatica.cop.rule.CreateListCop;
import org.pragmatica.cop.tree.SourceBuffer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class NodeCopTest {

    @Test
    void lint_reportsCreateListOffense() {
        var report = NodeCop.lint("3.times { create :user }");

        assertThat(report.offenses()).hasSize(1);
        assertEquals(CreateListCop.NAME, report.offenses().get(0).copName());
    }

    @Test
    void lint_namedBuffer_formatsWithFileName() {
        var report = NodeCop.lint(SourceBuffer.of("spec/models/user_spec.rb", "3.times { create :user }\n"));

        assertEquals("""
            spec/models/user_spec.rb:1:1: C: RSpec/FactoryGirl/CreateList: Prefer create_list.
            3.times { create :user }
            ^^^^^^^""", report.format());
    }

    @Test
    void autocorrect_preservesCallStyle() {
        assertEquals("create_list :user, 3", NodeCop.autocorrect("3.times { create :user }"));
        assertEquals("create_list(:user, 3, admin: true)", NodeCop.autocorrect("3.times { create(:user, admin: true) }"));
        assertEquals("create_list :post, 2, :published, author: bob",
                     NodeCop.autocorrect("2.times { create :post, :published, author: bob }"));
        assertEquals("Factory.create_list :widget, 5", NodeCop.autocorrect("5.times { Factory.create :widget }"));
    }

    @Test
    void autocorrect_cleanSource_isUnchanged() {
        var source = "3.times { |n| create :user, position: n }\n";

        assertEquals(source, NodeCop.autocorrect(source));
    }

    @Test
    void builder_appliesSettings() {
        var linter = NodeCop.builder()
                            .autocorrect(true)
                            .parallel(true)
                            .maxIterations(10)
                            .build();

        assertTrue(linter.config().autocorrect());
        assertTrue(linter.config().parallel());
        assertEquals(10, linter.config().maxIterations());
        assertThat(linter.cops()).hasSize(1);
        assertEquals("create_list :user, 3", linter.lint("3.times { create :user }").source());
    }

    @Test
    void builder_explicitCops_replaceDefaults() {
        var linter = NodeCop.builder()
                            .cop(CreateListCop.create())
                            .cop(CreateListCop.create())
                            .build();

        assertThat(linter.cops()).hasSize(2);
        assertFalse(linter.config().autocorrect());
    }
}
