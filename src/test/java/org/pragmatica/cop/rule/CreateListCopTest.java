package org.pragmatica.cop.rule;

import org.junit.jupiter.api.Test;
import org.pragmatica.cop.parser.SourceParser;
import org.pragmatica.cop.tree.SourceBuffer;
import org.pragmatica.cop.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CreateListCopTest {

    private final CreateListCop cop = CreateListCop.create();

    private Optional<DetectedIdiom> detect(String source) {
        return detectIn(SourceParser.parse(source));
    }

    private Optional<DetectedIdiom> detectIn(SyntaxNode root) {
        return root.descendants().stream()
                   .filter(node -> cop.nodeTypes().contains(node.type()))
                   .map(cop::detect)
                   .flatMap(Optional::stream)
                   .findFirst();
    }

    private String correct(String source) {
        var idiom = detect(source).orElseThrow();
        return cop.rewrite(idiom).applyTo(source);
    }

    // === Detection ===

    @Test
    void detect_simpleIdiom_bindsCountFactoryAndNoOptions() {
        var idiom = detect("3.times { create :user }").orElseThrow();

        assertEquals(3L, idiom.count());
        assertEquals("user", idiom.factory());
        assertTrue(idiom.receiver().isEmpty());
        assertThat(idiom.options()).isEmpty();
        assertEquals("3", idiom.countNode().source());
        assertEquals("create :user", idiom.factoryCall().source());
    }

    @Test
    void detect_options_keepSourceOrder() {
        var idiom = detect("2.times { create :post, :published, author: bob }").orElseThrow();

        assertThat(idiom.options()).extracting(SyntaxNode::source)
                                   .containsExactly(":published", "author: bob");
    }

    @Test
    void detect_doBlock_isFlagged() {
        assertTrue(detect("3.times do\n  create :user\nend").isPresent());
    }

    @Test
    void detect_blockWithParameters_isNotFlagged() {
        assertTrue(detect("3.times { |n| create :user, position: n }").isEmpty());
        assertTrue(detect("3.times { |n| create :user }").isEmpty());
    }

    @Test
    void detect_numberedParameters_isNotFlagged() {
        assertTrue(detect("3.times { create :user, position: _1 }").isEmpty());
    }

    @Test
    void detect_multipleStatements_isNotFlagged() {
        assertTrue(detect("3.times { create :user; create :post }").isEmpty());
        assertTrue(detect("3.times do\n  create :user\n  puts 'created'\nend").isEmpty());
    }

    @Test
    void detect_otherBodyShapes_areNotFlagged() {
        assertTrue(detect("3.times { build :user }").isEmpty());
        assertTrue(detect("3.times { create 'user' }").isEmpty());
        assertTrue(detect("3.times { create }").isEmpty());
        assertTrue(detect("3.times { user.create :user }").isEmpty());
        assertTrue(detect("3.times { }").isEmpty());
        assertTrue(detect("3.times { (create :user) }").isEmpty());
    }

    @Test
    void detect_nonLiteralCount_isNotFlagged() {
        assertTrue(detect("count.times { create :user }").isEmpty());
        assertTrue(detect("3.each { create :user }").isEmpty());
        assertTrue(detect("times { create :user }").isEmpty());
    }

    @Test
    void detect_nonBlockNode_isEmpty() {
        var root = SourceParser.parse("create :user");

        assertTrue(cop.detect(root).isEmpty());
    }

    @Test
    void detect_nonMatch_isIdempotent() {
        var root = SourceParser.parse("3.times { |n| create :user }");

        assertEquals(cop.detect(root), cop.detect(root));
        assertTrue(cop.detect(root).isEmpty());
    }

    @Test
    void detect_doesNotDependOnTraversalOrder() {
        var root = SourceParser.parse("""
            2.times { create :post }
            x = 1
            4.times { create :comment }
            """);
        var blocks = root.descendants().stream().filter(node -> node.is("block")).toList();

        var forward = blocks.stream().map(cop::detect).flatMap(Optional::stream).map(DetectedIdiom::factory).toList();
        var backward = List.of(blocks.get(1), blocks.get(0)).stream()
                           .map(cop::detect)
                           .flatMap(Optional::stream)
                           .map(DetectedIdiom::factory)
                           .toList();

        assertThat(forward).containsExactly("post", "comment");
        assertThat(backward).containsExactly("comment", "post");
    }

    // === Offense location ===

    @Test
    void offenseSpan_coversCountCall() {
        var source = "x = 1\n3.times { create :user }";
        var idiom = detect(source).orElseThrow();
        var span = cop.offenseSpan(idiom);

        assertEquals("3.times", SourceBuffer.of(source).source(span));
        assertEquals(2, span.start().line());
    }

    // === Rewriting ===

    @Test
    void rewrite_bareCall_staysBare() {
        assertEquals("create_list :user, 3", correct("3.times { create :user }"));
    }

    @Test
    void rewrite_parenthesizedCall_keepsParentheses() {
        assertEquals("create_list(:user, 3, admin: true)", correct("3.times { create(:user, admin: true) }"));
    }

    @Test
    void rewrite_options_areCopiedVerbatimInOrder() {
        assertEquals("create_list :post, 2, :published, author: bob",
                     correct("2.times { create :post, :published, author: bob }"));
        assertEquals("create_list :user, 2, 'name' =>  'x'",
                     correct("2.times { create :user, 'name' =>  'x' }"));
    }

    @Test
    void rewrite_receiver_isKept() {
        assertEquals("Factory.create_list :widget, 5", correct("5.times { Factory.create :widget }"));
        assertEquals("FactoryGirl::Syntax.create_list(:widget, 5)",
                     correct("5.times { FactoryGirl::Syntax.create(:widget) }"));
    }

    @Test
    void rewrite_countIsPrintedAsValue() {
        assertEquals("create_list :user, 1000", correct("1_000.times { create :user }"));
    }

    @Test
    void rewrite_factorySymbolIsCopiedVerbatim() {
        assertEquals("create_list :\"admin_user\", 2", correct("2.times { create :\"admin_user\" }"));
    }

    @Test
    void rewrite_doBlock_replacesWholeBlock() {
        var source = "before\n3.times do\n  create :user\nend\nafter\n";

        assertEquals("before\ncreate_list :user, 3\nafter\n", correct(source));
    }

    @Test
    void rewrite_surroundingText_isUntouched() {
        var source = "let(:x) { 1 }\n  3.times { create :user } # seed\n";

        assertEquals("let(:x) { 1 }\n  create_list :user, 3 # seed\n", correct(source));
    }

    @Test
    void rewrite_result_isNotFlaggedAgain() {
        var corrected = correct("3.times { create(:user, admin: true) }");

        assertTrue(detect(corrected).isEmpty());
    }

    @Test
    void generate_multilineOptions_keepsFormatting() {
        var source = """
            3.times do
              create(:user,
                     admin: true)
            end
            """;

        assertEquals("create_list(:user, 3, admin: true)\n", correct(source));
    }
}
