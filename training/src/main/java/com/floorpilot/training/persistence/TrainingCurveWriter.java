package com.floorpilot.training.persistence;

import com.floorpilot.shared.util.StatisticsReducer;
import com.floorpilot.training.model.EpisodeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Writes per-episode return and production, with trailing moving averages, as CSV.
 */
@Component
public class TrainingCurveWriter {

    private static final Logger log = LoggerFactory.getLogger(TrainingCurveWriter.class);

    static final String HEADER = "episode,return,good_parts,defective_parts,return_avg,good_parts_avg";

    private final StatisticsReducer statistics;

    public TrainingCurveWriter(StatisticsReducer statistics) {
        this.statistics = statistics;
    }

    public void write(List<EpisodeResult> results, int window, Path path) {
        double[] returns = results.stream().mapToDouble(EpisodeResult::totalReturn).toArray();
        double[] produced = results.stream().mapToDouble(EpisodeResult::goodParts).toArray();
        double[] returnAverages = statistics.movingAverage(returns, window);
        double[] producedAverages = statistics.movingAverage(produced, window);

        try {
            ValueTableStore.createParent(path);
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                writer.write(HEADER);
                writer.newLine();
                for (int i = 0; i < results.size(); i++) {
                    EpisodeResult result = results.get(i);
                    writer.write(String.format(Locale.ROOT, "%d,%.4f,%d,%d,%.4f,%.4f",
                        result.episode(), result.totalReturn(), result.goodParts(), result.defectiveParts(),
                        returnAverages[i], producedAverages[i]));
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write training curves to " + path, e);
        }
        log.info("Wrote training curves for {} episodes to {}", results.size(), path);
    }
}
