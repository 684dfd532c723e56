package org.pragmatica.cop.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.cop.tree.SourceBuffer;
import org.pragmatica.cop.tree.SyntaxNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SourceParserTest {

    private static String tree(String source) {
        return SourceParser.parse(source).toString();
    }

    // === Literals and calls ===

    @Test
    void parse_literals_produceTypedNodes() {
        assertEquals("(int 1000)", tree("1_000"));
        assertEquals("(float 1.5)", tree("1.5"));
        assertEquals("(str \"a\")", tree("'a'"));
        assertEquals("(sym :user)", tree(":user"));
        assertEquals("(sym :user)", tree(":\"user\""));
        assertEquals("(nil)", tree("nil"));
        assertEquals("(const nil :Factory)", tree("Factory"));
    }

    @Test
    void parse_commandCall_collectsBareArguments() {
        assertEquals("(send nil :create (sym :user))", tree("create :user"));
        assertEquals("(send nil :create (sym :post) (sym :published))", tree("create :post, :published"));
    }

    @Test
    void parse_keywordArguments_groupIntoTrailingHash() {
        assertEquals("(send nil :create (sym :user) (hash (pair (sym :admin) (true))))",
                     tree("create(:user, admin: true)"));
        assertEquals("(send nil :create (sym :user) (hash (pair (str \"k\") (int 1)) (pair (sym :a) (int 2))))",
                     tree("create :user, 'k' => 1, a: 2"));
    }

    @Test
    void parse_positionalAfterKeyword_fails() {
        assertThrows(SourceParseException.class, () -> SourceParser.parse("create :user, a: 1, :b"));
    }

    @Test
    void parse_soleParenthesizedArgument_mayBeCommand() {
        assertEquals("(send nil :create (send nil :build (sym :user) (int 2)))", tree("create(build :user, 2)"));
    }

    @Test
    void parse_commandAfterFirstParenthesizedArgument_fails() {
        assertThrows(SourceParseException.class, () -> SourceParser.parse("create(:user, build :post)"));
    }

    @Test
    void parse_commandAsHashValue_fails() {
        assertThrows(SourceParseException.class,
                     () -> SourceParser.parse("create_list(:user, 3, friends: create_list :friend, 2)"));
        assertThrows(SourceParseException.class,
                     () -> SourceParser.parse("create_list :user, 3, friends: create_list :friend, 2"));
    }

    @Test
    void parse_doAfterKeywordArguments_bindsToOuterCall() {
        assertEquals("(block (send nil :it (str \"x\") (hash (pair (sym :tag) (send nil :slow)))) (args) nil)",
                     tree("it 'x', tag: slow do\nend"));
    }

    @Test
    void parse_methodChain_nestsReceivers() {
        assertEquals("(send (send (int 3) :months) :ago)", tree("3.months.ago"));
        assertEquals("(csend (send nil :user) :name)", tree("user&.name"));
        assertEquals("(send (const (const nil :FactoryGirl) :Syntax) :create (sym :user))",
                     tree("FactoryGirl::Syntax.create :user"));
    }

    @Test
    void parse_nestedCommand_bindsToFirstArgument() {
        var root = SourceParser.parse("x = 0\nexpect(x).to eq 1");

        assertEquals("begin", root.type());
        assertEquals("(lvasgn :x (int 0))", root.nodeAt(0).orElseThrow().toString());
        assertEquals("(send (send nil :expect (lvar :x)) :to (send nil :eq (int 1)))",
                     root.nodeAt(1).orElseThrow().toString());
    }

    @Test
    void parse_collections_produceArrayAndHash() {
        assertEquals("(array (int 1) (sym :a))", tree("[1, :a]"));
        assertEquals("(lvasgn :x (hash (pair (sym :a) (int 1))))", tree("x = {a: 1}"));
    }

    // === Blocks ===

    @Test
    void parse_braceBlock_hasEmptyArgs() {
        assertEquals("(block (send (int 3) :times) (args) (send nil :create (sym :user)))",
                     tree("3.times { create :user }"));
    }

    @Test
    void parse_doBlock_matchesBraceBlock() {
        assertEquals(tree("3.times { create :user }"),
                     tree("3.times do\n  create :user\nend"));
    }

    @Test
    void parse_blockParameters_areLocalInBody() {
        assertEquals("(block (send (int 3) :times) (args (arg :n)) (send nil :create (sym :user) (lvar :n)))",
                     tree("3.times { |n| create :user, n }"));
    }

    @Test
    void parse_numberedParameter_producesNumblock() {
        assertEquals("(numblock (send (int 3) :times) 2 (send nil :create (sym :user) (lvar :_1) (lvar :_2)))",
                     tree("3.times { create :user, _1, _2 }"));
    }

    @Test
    void parse_emptyBlock_hasNilBody() {
        assertEquals("(block (send (int 3) :times) (args) nil)", tree("3.times { }"));
    }

    @Test
    void parse_multipleStatements_wrapInBegin() {
        assertEquals("(block (send (int 3) :times) (args) (begin (send nil :create (sym :user)) (send nil :puts (str \"x\"))))",
                     tree("3.times { create :user; puts 'x' }"));
    }

    @Test
    void parse_parenthesizedStatement_isBegin() {
        assertEquals("(block (send (int 3) :times) (args) (begin (send nil :create (sym :user))))",
                     tree("3.times { (create :user) }"));
    }

    @Test
    void parse_braceAfterCommandArguments_fails() {
        assertThrows(SourceParseException.class, () -> SourceParser.parse("create :user { }"));
    }

    // === Locations ===

    @Test
    void parse_parenthesizedCall_recordsDelimiters() {
        var buffer = SourceBuffer.of("create(:user, admin: true)");
        var call = SourceParser.parse(buffer).orElseThrow();

        assertEquals("(", call.location().beginSource().orElseThrow());
        assertEquals(")", call.location().endSource().orElseThrow());
        assertEquals("create", buffer.source(call.location().selector().orElseThrow()));
        assertEquals("admin: true", call.nodeAt(3).orElseThrow().source());
    }

    @Test
    void parse_commandCall_hasNoDelimiters() {
        var call = SourceParser.parse("create :user, 3");

        assertTrue(call.location().begin().isEmpty());
        assertEquals("create :user, 3", call.source());
    }

    @Test
    void parse_block_spansWholeExpression() {
        var buffer = SourceBuffer.of("before\n  3.times { create :user }\nafter\n");
        var root = SourceParser.parse(buffer).orElseThrow();
        var block = root.descendants().stream()
                        .filter(node -> node.is("block"))
                        .findFirst()
                        .orElseThrow();

        assertEquals("3.times { create :user }", block.source());
        assertEquals(2, block.span().start().line());
        assertEquals(3, block.span().start().column());
        assertEquals("3.times", block.nodeAt(0).map(SyntaxNode::source).orElseThrow());
    }

    @Test
    void parse_labelKey_excludesColon() {
        var hash = SourceParser.parse("create :user, admin: true").nodeAt(3).orElseThrow();
        var key = hash.nodeAt(0).flatMap(pair -> pair.nodeAt(0)).orElseThrow();

        assertEquals("admin", key.source());
    }

    // === Input handling ===

    @Test
    void parse_commentsAndBlankLines_areIgnored() {
        var source = """
            # frozen_string_literal: true

            create :user # trailing
            """;

        assertEquals("(send nil :create (sym :user))", tree(source));
    }

    @Test
    void parse_emptyBuffer_isEmpty() {
        assertTrue(SourceParser.parse(SourceBuffer.of("# only a comment\n")).isEmpty());
        assertThrows(SourceParseException.class, () -> SourceParser.parse(""));
    }

    @Test
    void parse_unsupportedKeyword_reportsLocation() {
        var error = assertThrows(SourceParseException.class,
                                 () -> SourceParser.parse(SourceBuffer.of("spec.rb", "x = 1\nif x")));

        assertEquals("spec.rb", error.sourceName());
        assertEquals(2, error.location().line());
        assertThat(error.getMessage()).contains("Unsupported keyword 'if'");
    }

    @Test
    void parse_lineContinuation_acceptsCrLf() {
        assertEquals("(send nil :create (sym :user) (hash (pair (sym :admin) (true))))",
                     tree("create :user, \\\r\n  admin: true"));
        assertEquals(tree("create :user, admin: true"), tree("create :user, \\\n  admin: true"));
    }

    @Test
    void parse_unterminatedString_fails() {
        assertThrows(SourceParseException.class, () -> SourceParser.parse("create 'user"));
    }

    @Test
    void parse_unclosedBlock_fails() {
        var error = assertThrows(SourceParseException.class, () -> SourceParser.parse("3.times { create :user"));

        assertThat(error.getMessage()).contains("expected '}'");
    }
}
