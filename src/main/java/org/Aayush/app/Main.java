package org.Aayush.app;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import org.Aayush.series.aggregate.AggregateTimeline;
import org.Aayush.series.controller.FetchResult;
import org.Aayush.series.controller.SeriesController;
import org.Aayush.series.controller.SeriesException;
import org.Aayush.series.controller.SeriesRuntimeConfig;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Smoke-run entry point: describes the files listed by a metafile and resolves times to files.
 *
 * <p>Usage: {@code Main <metafile> [time ...]}</p>
 */
public class Main {
    /**
     * Launches the smoke run and exits non-zero on failure.
     *
     * @param args metafile followed by requested times.
     */
    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1) {
            err.println("usage: Main <metafile> [time ...]");
            return 2;
        }

        SeriesController<Path> controller = SeriesController.<Path>builder()
                .reader(new PathSeriesReader())
                .config(SeriesRuntimeConfig.metaFile(args[0]))
                .build();
        try {
            AggregateTimeline timeline = controller.describe();
            out.println("inputs=" + controller.sourceCount());
            if (timeline.temporal()) {
                out.println("range=[" + timeline.start() + ", " + timeline.end() + "]");
                out.println("steps=" + timeline.steps());
            } else {
                out.println("timeline=" + timeline.status());
            }
            for (int i = 1; i < args.length; i++) {
                double time = Double.parseDouble(args[i]);
                FetchResult<Path> result = controller.fetch(DoubleArrayList.wrap(new double[]{time}));
                out.println(time + " -> " + result.getIndex() + " " + result.getData());
            }
            return 0;
        } catch (SeriesException | NumberFormatException ex) {
            err.println(ex.getMessage());
            return 1;
        }
    }
}
