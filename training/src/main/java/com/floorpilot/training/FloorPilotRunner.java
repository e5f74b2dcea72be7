package com.floorpilot.training;

import com.floorpilot.training.config.FloorPilotProperties;
import com.floorpilot.training.service.EvaluationService;
import com.floorpilot.training.service.TrainingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Dispatches on the run mode: the first command-line argument if given,
 * otherwise {@code floorpilot.run.mode}.
 */
@Component
public class FloorPilotRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(FloorPilotRunner.class);

    private final FloorPilotProperties properties;
    private final TrainingService trainingService;
    private final EvaluationService evaluationService;

    public FloorPilotRunner(FloorPilotProperties properties, TrainingService trainingService,
                            EvaluationService evaluationService) {
        this.properties = properties;
        this.trainingService = trainingService;
        this.evaluationService = evaluationService;
    }

    @Override
    public void run(String... args) {
        String mode = args.length > 0 && !args[0].startsWith("--") ? args[0] : properties.getRun().getMode();
        switch (mode) {
            case "train" -> trainingService.train();
            case "evaluate" -> evaluationService.evaluateStored(false);
            case "test" -> evaluationService.evaluateStored(true);
            case "none" -> log.debug("Run mode 'none'; nothing to do");
            default -> throw new IllegalArgumentException(
                "Unknown run mode '" + mode + "'; expected train, evaluate, test or none");
        }
    }
}
