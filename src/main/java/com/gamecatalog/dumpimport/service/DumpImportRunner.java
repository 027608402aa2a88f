package com.gamecatalog.dumpimport.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs one full import at startup when {@code app.import.run-on-startup} is set.
 */
@Component
public class DumpImportRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DumpImportRunner.class);

    private final DumpImportService dumpImportService;
    private final boolean runOnStartup;

    public DumpImportRunner(DumpImportService dumpImportService,
                            @Value("${app.import.run-on-startup:false}") boolean runOnStartup) {
        this.dumpImportService = dumpImportService;
        this.runOnStartup = runOnStartup;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!runOnStartup) {
            logger.debug("Startup import disabled");
            return;
        }
        dumpImportService.importAll();
    }
}
