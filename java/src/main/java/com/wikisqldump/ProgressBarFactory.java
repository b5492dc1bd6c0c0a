package com.wikisqldump;

import me.tongfei.progressbar.ProgressBar;
import me.tongfei.progressbar.ProgressBarBuilder;
import me.tongfei.progressbar.ProgressBarConsumer;
import me.tongfei.progressbar.ProgressBarStyle;

/**
 * Creates the conversion progress bar. In debug mode the bar still counts
 * but renders nowhere, leaving the console to log output.
 */
public class ProgressBarFactory {
    private final boolean debug;

    public ProgressBarFactory(boolean debug) {
        this.debug = debug;
    }

    /**
     * @param max expected number of characters, or -1 when unknown (compressed input)
     */
    public ProgressBar create(String taskName, long max) {
        ProgressBarBuilder builder = new ProgressBarBuilder()
                .setTaskName(taskName)
                .setInitialMax(max)
                .setUnit(" chars", 1)
                .setStyle(ProgressBarStyle.ASCII);
        if (debug) {
            builder.setConsumer(new SilentConsumer());
        }
        return builder.build();
    }

    private static final class SilentConsumer implements ProgressBarConsumer {
        @Override
        public int getMaxRenderedLength() {
            return 0;
        }

        @Override
        public void accept(String rendered) {
            // rendering disabled in debug mode
        }

        @Override
        public void close() {
            // nothing to release
        }
    }
}
