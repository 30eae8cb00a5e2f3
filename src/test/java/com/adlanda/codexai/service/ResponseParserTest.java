package com.adlanda.codexai.service;

import com.adlanda.codexai.exception.ParseException;
import com.adlanda.codexai.model.ProposedScene;
import com.adlanda.codexai.model.SceneDraft;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser();

    @Test
    void numberedList_extractsItemsInOrder() {
        assertThat(parser.numberedList("1. A\n2. B\n3. C", 3)).containsExactly("A", "B", "C");
    }

    @Test
    void numberedList_noNumberedLines_returnsEmpty() {
        assertThat(parser.numberedList("I cannot help with that.", 3)).isEmpty();
    }

    @Test
    void numberedList_ignoresSurroundingTextAndTrims() {
        String reply = """
            Here are some options:
              1.   The rain fell softly.
            2. Rain drifted down.

            3.
            4. Softly, the rain came.
            """;

        assertThat(parser.numberedList(reply, 3))
                .containsExactly("The rain fell softly.", "Rain drifted down.", "Softly, the rain came.");
    }

    @Test
    void numberedList_itemOnFollowingLine_isKept() {
        assertThat(parser.numberedList("1.\nThe rain fell.\n2. Rain drifted down.", 2))
                .containsExactly("The rain fell.", "Rain drifted down.");
        assertThat(parser.numberedList("1.\r\n  The rain fell.\r\n2. Rain drifted down.", 2))
                .containsExactly("The rain fell.", "Rain drifted down.");
    }

    @Test
    void numberedList_decimalNumbers_areNotItems() {
        String reply = "Some 1.5 million drops fell.\n1. The rain fell.\n2.5 inches by noon.";

        assertThat(parser.numberedList(reply, 1)).containsExactly("The rain fell.");
    }

    @Test
    void numberedList_returnsMoreThanExpectedWithoutTruncating() {
        assertThat(parser.numberedList("1. A\n2. B\n3. C\n4. D", 3)).hasSize(4);
    }

    @Test
    void sceneDraft_headingBecomesTitle() {
        SceneDraft draft = parser.sceneDraft("## The Glove\n\nLane kneels by the window.");

        assertThat(draft.title()).isEqualTo("The Glove");
        assertThat(draft.content()).isEqualTo("Lane kneels by the window.");
    }

    @Test
    void sceneDraft_withoutHeading_usesPlaceholderTitle() {
        SceneDraft draft = parser.sceneDraft("Lane kneels by the window.");

        assertThat(draft.title()).isEqualTo(ResponseParser.UNTITLED_SCENE);
        assertThat(draft.content()).isEqualTo("Lane kneels by the window.");
    }

    @Test
    void sceneDraft_fencedReply_isUnwrapped() {
        SceneDraft draft = parser.sceneDraft("```markdown\n# Dawn\nThe sun rose.\n```");

        assertThat(draft.title()).isEqualTo("Dawn");
        assertThat(draft.content()).isEqualTo("The sun rose.");
    }

    @Test
    void sceneDraft_headingOnly_throwsParseException() {
        assertThatThrownBy(() -> parser.sceneDraft("## Lonely Title\n"))
                .isInstanceOf(ParseException.class);
    }

    @Test
    void sceneList_parsesBlocksInOrder() {
        String reply = """
            <<<SCENE>>>
            TITLE: Arrival
            CONTENT:
            Lane arrives.
            He knocks.
            <<<END_SCENE>>>
            <<<SCENE>>>
            TITLE: The Clue
            CONTENT:
            A glove.
            <<<END_SCENE>>>
            """;

        List<ProposedScene> scenes = parser.sceneList(reply);

        assertThat(scenes).containsExactly(
                new ProposedScene("Arrival", "Lane arrives.\nHe knocks."),
                new ProposedScene("The Clue", "A glove."));
    }

    @Test
    void sceneList_missingTitle_usesPlaceholder() {
        List<ProposedScene> scenes = parser.sceneList("<<<SCENE>>>\nCONTENT:\nJust text.\n<<<END_SCENE>>>");

        assertThat(scenes).containsExactly(new ProposedScene(ResponseParser.UNTITLED_SCENE, "Just text."));
    }

    @Test
    void sceneList_skipsMalformedBlocksAndKeepsTheRest() {
        String reply = """
            <<<SCENE>>>
            TITLE: Empty
            CONTENT:
            <<<END_SCENE>>>
            <<<SCENE>>>
            TITLE: Unterminated
            CONTENT:
            Lost text.
            <<<SCENE>>>
            TITLE: Good
            CONTENT:
            Kept text.
            <<<END_SCENE>>>
            <<<SCENE>>>
            TITLE: Trailing
            CONTENT:
            Never closed.
            """;

        assertThat(parser.sceneList(reply)).containsExactly(new ProposedScene("Good", "Kept text."));
    }

    @Test
    void sceneList_noBlocks_returnsEmpty() {
        assertThat(parser.sceneList("I could not split this chapter.")).isEmpty();
    }

    @Test
    void isErrorReply_detectsErrorPrefix() {
        assertThat(parser.isErrorReply("  Error: rate limit exceeded")).isTrue();
        assertThat(parser.isErrorReply("1. Errors were made.")).isFalse();
    }
}
