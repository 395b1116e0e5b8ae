package com.pagewright.core.frontmatter;

import com.pagewright.core.error.BuildException;
import com.pagewright.core.error.FrontMatterException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Line based front matter splitter.
 *
 * <p>A block opens only when the start delimiter is the very first line of the file and closes at
 * the next line equal to the end delimiter.
 */
public class DelimitedFrontMatterLoader implements FrontMatterLoader {

    @Override
    public FrontMatter load(Path file, FrontMatterConfig config) {
        try {
            return split(Files.readString(file, StandardCharsets.UTF_8), file, config);
        } catch (IOException e) {
            throw new BuildException("Failed to read file: " + file, file, e);
        }
    }

    @Override
    public FrontMatter split(String content, Path file, FrontMatterConfig config) {
        String[] lines = content.split("\\R", -1);
        if (lines.length == 0 || !lines[0].trim().equals(config.start())) {
            return FrontMatter.none(content);
        }

        StringBuilder text = new StringBuilder();
        StringBuilder body = new StringBuilder();
        boolean terminated = false;
        int i = 1;
        // Opening line
        body.append('\n');
        for (; i < lines.length; i++) {
            String line = lines[i];
            body.append('\n');
            if (line.trim().equals(config.end())) {
                terminated = true;
                i++;
                break;
            }
            text.append(line).append('\n');
        }

        if (!terminated) {
            throw FrontMatterException.notTerminated(file);
        }

        for (; i < lines.length; i++) {
            body.append(lines[i]);
            if (i < lines.length - 1) {
                body.append('\n');
            }
        }
        return new FrontMatter(body.toString(), true, text.toString());
    }
}
