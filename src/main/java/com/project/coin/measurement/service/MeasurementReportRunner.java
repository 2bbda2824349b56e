package com.project.coin.measurement.service;

import com.project.coin.measurement.model.DetectedObject;
import com.project.coin.measurement.model.MeasuredImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

/**
 * Console mode ({@code --report}): measures every image of the input directory in name order and
 * prints the objects found. Unreadable files are skipped.
 */
@Component
public class MeasurementReportRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(MeasurementReportRunner.class);

    public static final String REPORT_OPTION = "report";

    private final ImageDirectoryService directory;
    private final CoinMeasurementService measurementService;

    public MeasurementReportRunner(ImageDirectoryService directory, CoinMeasurementService measurementService) {
        this.directory = directory;
        this.measurementService = measurementService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(REPORT_OPTION)) {
            writeReport(System.out);
        }
    }

    /**
     * @return number of images that could be measured
     */
    public int writeReport(PrintStream out) {
        List<String> names = directory.listImages();
        int measured = 0;
        for (String name : names) {
            Optional<MeasuredImage> result = measurementService.measure(directory.getRootDir().resolve(name));
            if (result.isEmpty()) {
                log.warn("Skipping unreadable image {}", name);
                continue;
            }
            measured++;
            List<DetectedObject> objects = result.get().objects();
            out.println();
            out.println(name + ": detected " + objects.size() + " objects.");
            for (DetectedObject o : objects) {
                out.println(o.describe());
            }
        }
        log.info("Report finished: {} of {} files measured", measured, names.size());
        return measured;
    }
}
