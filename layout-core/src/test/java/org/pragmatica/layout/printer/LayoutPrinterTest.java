package org.pragmatica.layout.printer;

import org.junit.jupiter.api.Test;
import org.pragmatica.layout.Indentation;
import org.pragmatica.layout.LayoutConfig;
import org.pragmatica.layout.token.BreakKind;
import org.pragmatica.layout.token.GroupBreakStyle;
import org.pragmatica.layout.token.NewlineBehavior;
import org.pragmatica.layout.token.OpenBreakKind;
import org.pragmatica.layout.token.Token;
import org.pragmatica.layout.token.Verbatim.IndentingBehavior;

import java.util.ArrayList;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.layout.printer.LayoutPrinter.layoutPrinter;
import static org.pragmatica.layout.token.TokenStream.tokenStream;
import static org.pragmatica.layout.token.Tokens.blockComment;
import static org.pragmatica.layout.token.Tokens.breakToken;
import static org.pragmatica.layout.token.Tokens.close;
import static org.pragmatica.layout.token.Tokens.commaRegionEnd;
import static org.pragmatica.layout.token.Tokens.commaRegionStart;
import static org.pragmatica.layout.token.Tokens.disableBreaking;
import static org.pragmatica.layout.token.Tokens.discretionaryNewlines;
import static org.pragmatica.layout.token.Tokens.enableBreaking;
import static org.pragmatica.layout.token.Tokens.flexibleSpace;
import static org.pragmatica.layout.token.Tokens.hardNewline;
import static org.pragmatica.layout.token.Tokens.lineComment;
import static org.pragmatica.layout.token.Tokens.newline;
import static org.pragmatica.layout.token.Tokens.open;
import static org.pragmatica.layout.token.Tokens.space;
import static org.pragmatica.layout.token.Tokens.text;
import static org.pragmatica.layout.token.Tokens.verbatim;

class LayoutPrinterTest {
    private static final LayoutConfig CONFIG = LayoutConfig.defaultConfig();

    private static String print(LayoutConfig config, Token... tokens) {
        return layoutPrinter(config).print(tokenStream(tokens))
                                    .text();
    }

    private static String print(int maxLineWidth, Token... tokens) {
        return print(CONFIG.withMaxLineWidth(maxLineWidth), tokens);
    }

    // ===== Groups =====

    @Test
    void consistentGroup_breaksAllDirectBreaks_whenGroupDoesNotFit() {
        Token[] tokens = {open(GroupBreakStyle.CONSISTENT),
                          text("a"), breakToken(BreakKind.SAME),
                          text("b"), breakToken(BreakKind.SAME),
                          text("c"),
                          close()};

        assertThat(print(3, tokens)).isEqualTo("a\nb\nc\n");
        assertThat(print(10, tokens)).isEqualTo("a b c\n");
    }

    @Test
    void consistentGroup_leavesNestedGroupFlat_whenNestedGroupFits() {
        Token[] tokens = {open(GroupBreakStyle.CONSISTENT),
                          text("outer"), breakToken(BreakKind.SAME),
                          open(GroupBreakStyle.CONSISTENT),
                          text("x"), breakToken(BreakKind.SAME), text("y"),
                          close(),
                          breakToken(BreakKind.SAME),
                          text("tail"),
                          close()};

        assertThat(print(10, tokens)).isEqualTo("outer\nx y\ntail\n");
    }

    @Test
    void inconsistentGroup_fillsLines_beforeBreaking() {
        var result = print(7,
                           open(),
                           text("aaa"), breakToken(BreakKind.SAME),
                           text("bbb"), breakToken(BreakKind.SAME),
                           text("ccc"), breakToken(BreakKind.SAME),
                           text("ddd"),
                           close());

        assertThat(result).isEqualTo("aaa bbb\nccc ddd\n");
    }

    @Test
    void inconsistentGroup_neverExceedsWidth_whenEveryWordFits() {
        var tokens = new ArrayList<Token>();
        tokens.add(open());
        IntStream.range(0, 40)
                 .forEach(i -> {
                     if (i > 0) {
                         tokens.add(breakToken(BreakKind.SAME));
                     }
                     tokens.add(text("w".repeat(1 + i % 12)));
                 });
        tokens.add(close());

        var output = print(30, tokens.toArray(Token[]::new));

        assertThat(output.lines()).hasSizeGreaterThan(1)
                                  .allSatisfy(line -> assertThat(line.length()).isLessThanOrEqualTo(30));
    }

    @Test
    void atomicText_mayExceedWidth_whenNoBreakIsAvailable() {
        assertThat(print(5, text("abcdefghij"))).isEqualTo("abcdefghij\n");
    }

    @Test
    void argumentList_wrapsOnlyWhereNeeded() {
        var result = print(20,
                           open(),
                           text("call("),
                           breakToken(BreakKind.OPEN, 0),
                           text("first,"), breakToken(BreakKind.SAME),
                           text("second,"), breakToken(BreakKind.SAME),
                           text("third"),
                           breakToken(BreakKind.close(false), 0),
                           text(");"),
                           close());

        assertThat(result).isEqualTo("call(first, second,\n  third);\n");
    }

    // ===== Indentation =====

    @Test
    void continuationAndReset_indentContinuationAndReturnToBase() {
        Token[] tokens = {open(),
                          text("if"), space(), text("condition"),
                          breakToken(BreakKind.CONTINUE),
                          text("&& other"),
                          breakToken(BreakKind.RESET),
                          text("{"),
                          close()};

        assertThat(print(15, tokens)).isEqualTo("if condition\n  && other\n{\n");
        assertThat(print(40, tokens)).isEqualTo("if condition && other {\n");
    }

    @Test
    void continuationOpen_indentsScope_whenItFires() {
        var result = print(40,
                           text("x ="),
                           breakToken(BreakKind.open(OpenBreakKind.CONTINUATION), 1, NewlineBehavior.SOFT),
                           text("y"),
                           breakToken(BreakKind.close(false), 0),
                           text(";"));

        assertThat(result).isEqualTo("x =\n  y;\n");
    }

    @Test
    void reset_firesOnFirstLineOfFiredContinuationOpen() {
        var result = print(12,
                           open(),
                           text("call("),
                           breakToken(BreakKind.open(OpenBreakKind.CONTINUATION), 0),
                           text("argument"),
                           breakToken(BreakKind.RESET),
                           text("{"),
                           breakToken(BreakKind.close(false), 0),
                           text(")"),
                           close());

        assertThat(result).isEqualTo("call(\n  argument\n{)\n");
    }

    @Test
    void sameBreak_keepsIndentOfFiredContinuationOpen() {
        var result = print(8,
                           open(),
                           text("call("),
                           breakToken(BreakKind.open(OpenBreakKind.CONTINUATION), 0),
                           text("alpha,"),
                           breakToken(BreakKind.SAME),
                           text("beta"),
                           breakToken(BreakKind.close(false), 0),
                           text(")"),
                           close());

        assertThat(result).isEqualTo("call(\n  alpha,\n  beta)\n");
    }

    @Test
    void blockScopes_nestIndentation() {
        var result = print(40,
                           text("a {"),
                           breakToken(BreakKind.OPEN, 0, NewlineBehavior.SOFT),
                           text("b {"),
                           breakToken(BreakKind.OPEN, 0, NewlineBehavior.SOFT),
                           text("c"),
                           breakToken(BreakKind.CLOSE, 0, NewlineBehavior.SOFT),
                           text("}"),
                           breakToken(BreakKind.CLOSE, 0, NewlineBehavior.SOFT),
                           text("}"));

        assertThat(result).isEqualTo("a {\n  b {\n    c\n  }\n}\n");
    }

    @Test
    void tabIndentation_writesTabsPerUnit() {
        var config = CONFIG.withIndentation(Indentation.tabs(1))
                           .withTabWidth(4);
        var result = print(config,
                           text("{"),
                           breakToken(BreakKind.OPEN, 0, NewlineBehavior.SOFT),
                           text("x"),
                           breakToken(BreakKind.CLOSE, 0, NewlineBehavior.SOFT),
                           text("}"));

        assertThat(result).isEqualTo("{\n\tx\n}\n");
    }

    // ===== Newlines =====

    @Test
    void softNewline_alwaysFires() {
        assertThat(print(100, text("a"), breakToken(BreakKind.SAME, 1, NewlineBehavior.SOFT), text("b")))
                  .isEqualTo("a\nb\n");
    }

    @Test
    void hardNewline_writesExactCount_regardlessOfBlankLineLimit() {
        var config = CONFIG.withMaxConsecutiveBlankLines(0);

        assertThat(print(config, text("a"), hardNewline(3), text("b"))).isEqualTo("a\n\n\nb\n");
    }

    @Test
    void leadingBreaks_writeNoBlankLines() {
        assertThat(print(100, newline(), text("a"))).isEqualTo("a\n");
        assertThat(print(100, hardNewline(2), text("a"))).isEqualTo("a\n");
    }

    @Test
    void breakAfterEndOfLineComment_keepsDeclaredNewlineCount() {
        var result = print(100,
                           text("a"), space(), lineComment("// c", true),
                           breakToken(BreakKind.SAME, 0, NewlineBehavior.soft(2, false)),
                           text("b"));

        assertThat(result).isEqualTo("a // c\n\nb\n");
    }

    @Test
    void hardNewline_firesInsideDisabledRegion() {
        var result = print(100,
                           disableBreaking(),
                           text("a"), hardNewline(2), text("b"),
                           enableBreaking());

        assertThat(result).isEqualTo("a\n\nb\n");
    }

    @Test
    void discretionaryNewlines_areCappedAtBlankLineLimit() {
        assertThat(print(CONFIG, text("a"), discretionaryNewlines(5), text("b"))).isEqualTo("a\n\nb\n");
        assertThat(print(CONFIG.withMaxConsecutiveBlankLines(3), text("a"), discretionaryNewlines(5), text("b")))
                  .isEqualTo("a\n\n\n\nb\n");
    }

    @Test
    void adjacentSoftBreaks_collapseIntoOneRun() {
        Token[] tokens = {text("a"),
                          newline(),
                          breakToken(BreakKind.SAME, 0, NewlineBehavior.soft(3, false)),
                          text("b")};

        assertThat(print(CONFIG, tokens)).isEqualTo("a\n\nb\n");
        assertThat(print(CONFIG.withMaxConsecutiveBlankLines(0), tokens)).isEqualTo("a\nb\n");
    }

    @Test
    void electiveBreak_preservesSourceBlankLine_whenDiscretionaryNewlinesRespected() {
        var sourceSpaced = breakToken(BreakKind.SAME, 1, NewlineBehavior.ELECTIVE, 3);

        assertThat(print(CONFIG, text("a"), sourceSpaced, text("b"))).isEqualTo("a\n\nb\n");
        assertThat(print(CONFIG.withRespectsDiscretionaryNewlines(false), text("a"), sourceSpaced, text("b")))
                  .isEqualTo("a b\n");
    }

    @Test
    void electiveBreak_ignoresSourceNewlines_whenMarkedSo() {
        var result = print(CONFIG,
                           text("a"),
                           breakToken(BreakKind.SAME, 1, NewlineBehavior.elective(true), 3),
                           text("b"));

        assertThat(result).isEqualTo("a b\n");
    }

    // ===== Printer control =====

    @Test
    void disabledBreaking_suppressesBreaks_evenWhenLineOverflows() {
        var result = print(5,
                           disableBreaking(),
                           open(GroupBreakStyle.CONSISTENT),
                           text("aaaa"), breakToken(BreakKind.SAME), text("bbbb"),
                           close(),
                           enableBreaking());

        assertThat(result).isEqualTo("aaaa bbbb\n");
    }

    @Test
    void disabledBreaking_suppressesSoftNewlines() {
        assertThat(print(100,
                         text("a"),
                         disableBreaking(),
                         breakToken(BreakKind.SAME, 1, NewlineBehavior.SOFT),
                         text("b"),
                         enableBreaking()))
                  .isEqualTo("a b\n");
    }

    @Test
    void disabledBreaking_nests() {
        var result = print(100,
                           disableBreaking(), disableBreaking(), enableBreaking(),
                           text("a"),
                           breakToken(BreakKind.SAME, 1, NewlineBehavior.SOFT),
                           text("b"),
                           enableBreaking());

        assertThat(result).isEqualTo("a b\n");
    }

    @Test
    void unmatchedEnableBreaking_isIgnored() {
        var result = print(100,
                           enableBreaking(),
                           text("a"),
                           breakToken(BreakKind.SAME, 1, NewlineBehavior.SOFT),
                           text("b"));

        assertThat(result).isEqualTo("a\nb\n");
    }

    // ===== Spaces, comments, verbatim =====

    @Test
    void flexibleSpace_collapsesAtStartOfLine() {
        var result = print(100,
                           text("a"), newline(), flexibleSpace(3), text("b"), flexibleSpace(1), text("c"));

        assertThat(result).isEqualTo("a\nb c\n");
    }

    @Test
    void endOfLineComment_forcesNextBreak() {
        var result = print(100,
                           text("x"), space(), lineComment("// note", true),
                           breakToken(BreakKind.SAME),
                           text("y"));

        assertThat(result).isEqualTo("x // note\ny\n");
    }

    @Test
    void endOfLineComment_forcesBreak_evenWhenBreakingDisabled() {
        var result = print(100,
                           disableBreaking(),
                           text("x"), space(), lineComment("// note", true),
                           breakToken(BreakKind.SAME),
                           text("y"),
                           enableBreaking());

        assertThat(result).isEqualTo("x // note\ny\n");
    }

    @Test
    void endOfLineComment_endsLine_whenTextFollowsDirectly() {
        assertThat(print(100, text("x"), space(), lineComment("// c", true), text("y"))).isEqualTo("x // c\ny\n");
    }

    @Test
    void inlineBlockComment_staysOnLine() {
        var result = print(100, text("a"), space(), blockComment("/* b */", false), space(), text("c"));

        assertThat(result).isEqualTo("a /* b */ c\n");
    }

    @Test
    void multilineBlockComment_isReindented() {
        var result = print(100,
                           text("{"),
                           breakToken(BreakKind.OPEN, 0, NewlineBehavior.SOFT),
                           blockComment("/*\n     * doc\n     */", false),
                           breakToken(BreakKind.SAME, 0, NewlineBehavior.SOFT),
                           text("x"),
                           breakToken(BreakKind.CLOSE, 0, NewlineBehavior.SOFT),
                           text("}"));

        assertThat(result).isEqualTo("{\n  /*\n   * doc\n   */\n  x\n}\n");
    }

    @Test
    void verbatim_followsIndentingBehavior() {
        assertThat(printVerbatimInBlock(IndentingBehavior.ALL_LINES, "a\nb")).isEqualTo("{\n  a\n  b\n}\n");
        assertThat(printVerbatimInBlock(IndentingBehavior.FIRST_LINE, "a\nb")).isEqualTo("{\n  a\nb\n}\n");
        assertThat(printVerbatimInBlock(IndentingBehavior.NONE, "a\n  b")).isEqualTo("{\na\n  b\n}\n");
    }

    private static String printVerbatimInBlock(IndentingBehavior indenting, String content) {
        return print(100,
                     text("{"),
                     breakToken(BreakKind.OPEN, 0, NewlineBehavior.SOFT),
                     verbatim(content, indenting),
                     breakToken(BreakKind.CLOSE, 0, NewlineBehavior.SOFT),
                     text("}"));
    }

    @Test
    void multilineVerbatim_preventsEnclosingGroupFromStayingFlat() {
        var result = print(100,
                           open(GroupBreakStyle.CONSISTENT),
                           text("x"), breakToken(BreakKind.SAME), verbatim("p\nq"),
                           close());

        assertThat(result).isEqualTo("x\np\nq\n");
    }

    @Test
    void wideCharacters_countByDisplayWidth() {
        Token[] tokens = {open(), text("漢字漢字"), breakToken(BreakKind.SAME), text("ab"), close()};

        assertThat(print(10, tokens)).isEqualTo("漢字漢字\nab\n");
        assertThat(print(11, tokens)).isEqualTo("漢字漢字 ab\n");
    }

    // ===== Comma regions =====

    @Test
    void trailingComma_goesBeforeEndOfLineComment() {
        var result = print(100,
                           open(GroupBreakStyle.CONSISTENT),
                           text("["),
                           breakToken(BreakKind.OPEN, 0),
                           commaRegionStart(),
                           text("1,"), breakToken(BreakKind.SAME),
                           text("2"), space(), lineComment("// two", true),
                           commaRegionEnd(false),
                           breakToken(BreakKind.CLOSE, 0),
                           text("]"),
                           close());

        assertThat(result).isEqualTo("[\n  1,\n  2, // two\n]\n");
    }

    @Test
    void regionWithoutContent_getsNoComma_evenWhenSpanningLines() {
        var result = layoutPrinter(CONFIG).print(tokenStream(open(GroupBreakStyle.CONSISTENT),
                                                             text("["),
                                                             breakToken(BreakKind.OPEN, 0),
                                                             commaRegionStart(),
                                                             blockComment("/* a\n b */", false),
                                                             commaRegionEnd(false),
                                                             breakToken(BreakKind.CLOSE, 0),
                                                             text("]"),
                                                             close()));

        assertThat(result.text()).isEqualTo("[\n  /* a\n  b */\n]\n");
        assertThat(result.trailingCommasAdded()).isZero();
    }

    @Test
    void singleElementRegion_getsNoComma_whenContentStaysOnOneLine() {
        var result = print(8,
                           open(GroupBreakStyle.CONSISTENT),
                           text("["),
                           breakToken(BreakKind.OPEN, 0),
                           commaRegionStart(),
                           text("element"),
                           commaRegionEnd(true),
                           breakToken(BreakKind.CLOSE, 0),
                           text("]"),
                           close());

        assertThat(result).isEqualTo("[\n  element\n]\n");
    }

    @Test
    void dumpTokens_doesNotChangeOutput() {
        Token[] tokens = {open(GroupBreakStyle.CONSISTENT), text("a"), breakToken(BreakKind.SAME), text("b"), close()};

        assertThat(print(CONFIG.withDumpTokens(true), tokens)).isEqualTo(print(CONFIG, tokens));
    }
}
