package com.project.coin.measurement;

import com.project.coin.measurement.service.MeasurementReportRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

/**
 * Entry point. Starts the inspection web UI, or with {@code --report} prints the measurements of
 * the input directory and exits.
 */
@SpringBootApplication
public class Application {
    public static void main(String[] args) {
        SpringApplication app = create(args);
        if (isReport(args)) {
            System.exit(SpringApplication.exit(app.run(args)));
        }
        app.run(args);
    }

    static SpringApplication create(String[] args) {
        SpringApplication app = new SpringApplication(Application.class);
        if (isReport(args)) {
            app.setWebApplicationType(WebApplicationType.NONE);
        }
        return app;
    }

    static boolean isReport(String[] args) {
        return Arrays.stream(args)
                .anyMatch(a -> a.equals("--" + MeasurementReportRunner.REPORT_OPTION));
    }
}
