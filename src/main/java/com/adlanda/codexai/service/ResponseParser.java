package com.adlanda.codexai.service;

import com.adlanda.codexai.exception.ParseException;
import com.adlanda.codexai.model.ProposedScene;
import com.adlanda.codexai.model.SceneDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts structured results from language model replies.
 */
@Component
public class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

    public static final String UNTITLED_SCENE = "Untitled Scene";

    // "1. item", or "1." with the item on the next line; "1.5" is not an ordinal
    private static final Pattern NUMBERED_LINE = Pattern.compile(
            "^[ \\t]*\\d+\\.(?:[ \\t]+|[ \\t]*\\r?\\n[ \\t]*(?!\\d+\\.))(\\S.*)$", Pattern.MULTILINE);
    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s+(.*?)\\s*#*\\s*$");
    private static final Pattern FENCED = Pattern.compile("^```[\\w-]*\\s*\\n(.*)\\n```$", Pattern.DOTALL);
    private static final String TITLE_PREFIX = "TITLE:";
    private static final String CONTENT_PREFIX = "CONTENT:";

    /**
     * Items of a numbered list ("1. ...", "2. ..."), trimmed, in document order.
     *
     * <p>Returns whatever was found, even when it does not match {@code expectedCount}.</p>
     */
    public List<String> numberedList(String text, int expectedCount) {
        List<String> items = new ArrayList<>();
        if (text == null) {
            return items;
        }
        Matcher matcher = NUMBERED_LINE.matcher(text);
        while (matcher.find()) {
            String item = matcher.group(1).trim();
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        if (items.size() != expectedCount) {
            log.debug("Numbered list has {} items, expected {}", items.size(), expectedCount);
        }
        return items;
    }

    /**
     * Scene blocks delimited by {@code <<<SCENE>>>} and {@code <<<END_SCENE>>>}, in reply order.
     *
     * <p>Each block may start with a {@code TITLE:} line; the scene text follows {@code CONTENT:}.
     * Blank and unterminated blocks are skipped.</p>
     */
    public List<ProposedScene> sceneList(String text) {
        List<ProposedScene> scenes = new ArrayList<>();
        if (text == null) {
            return scenes;
        }
        text = text.replace("\r\n", "\n");
        int position = 0;
        int blockNumber = 0;
        while (true) {
            int start = text.indexOf(PromptBuilder.SCENE_START, position);
            if (start < 0) {
                break;
            }
            blockNumber++;
            int bodyStart = start + PromptBuilder.SCENE_START.length();
            int end = text.indexOf(PromptBuilder.SCENE_END, bodyStart);
            int nextStart = text.indexOf(PromptBuilder.SCENE_START, bodyStart);

            if (end < 0 || (nextStart >= 0 && nextStart < end)) {
                log.warn("Skipping unterminated scene block {}", blockNumber);
                if (nextStart < 0) {
                    break;
                }
                position = nextStart;
                continue;
            }

            parseSceneBlock(text.substring(bodyStart, end)).ifPresentOrElse(
                    scenes::add,
                    () -> log.warn("Skipping scene block without content"));
            position = end + PromptBuilder.SCENE_END.length();
        }
        return scenes;
    }

    /**
     * A scene draft; a leading Markdown heading becomes the title.
     *
     * @throws ParseException if the reply has no scene text
     */
    public SceneDraft sceneDraft(String text) {
        String body = unfence(text == null ? "" : text.replace("\r\n", "\n").trim());
        if (body.isEmpty()) {
            throw new ParseException("Scene draft reply is empty");
        }

        String[] lines = body.split("\n", 2);
        Matcher heading = HEADING.matcher(lines[0].trim());
        if (!heading.matches()) {
            return new SceneDraft(UNTITLED_SCENE, body);
        }

        String title = heading.group(1).isBlank() ? UNTITLED_SCENE : heading.group(1).trim();
        String content = lines.length > 1 ? lines[1].trim() : "";
        if (content.isEmpty()) {
            throw new ParseException("Scene draft reply has a title but no content");
        }
        return new SceneDraft(title, content);
    }

    /**
     * Whether a reply reports a failure instead of carrying a result.
     */
    public boolean isErrorReply(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.trim();
        return trimmed.regionMatches(true, 0, "Error:", 0, "Error:".length());
    }

    private Optional<ProposedScene> parseSceneBlock(String block) {
        String title = null;
        StringBuilder content = new StringBuilder();
        boolean inContent = false;

        for (String line : block.strip().split("\n", -1)) {
            String trimmed = line.trim();
            if (!inContent && title == null && startsWithIgnoreCase(trimmed, TITLE_PREFIX)) {
                title = trimmed.substring(TITLE_PREFIX.length()).trim();
            } else if (!inContent && startsWithIgnoreCase(trimmed, CONTENT_PREFIX)) {
                inContent = true;
                String rest = trimmed.substring(CONTENT_PREFIX.length()).trim();
                if (!rest.isEmpty()) {
                    content.append(rest).append('\n');
                }
            } else {
                content.append(line).append('\n');
            }
        }

        String sceneText = content.toString().strip();
        if (sceneText.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ProposedScene(
                title == null || title.isEmpty() ? UNTITLED_SCENE : title, sceneText));
    }

    private static boolean startsWithIgnoreCase(String text, String prefix) {
        return text.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    private static String unfence(String text) {
        Matcher fenced = FENCED.matcher(text);
        return fenced.matches() ? fenced.group(1).trim() : text;
    }
}
