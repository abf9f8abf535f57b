package com.flagship.fec_diligence.cli;

import com.flagship.fec_diligence.analysis.DiligenceAnalysisService;
import com.flagship.fec_diligence.analysis.DiligencePack;
import com.flagship.fec_diligence.analysis.DiligenceReportWriter;
import com.flagship.fec_diligence.analysis.LedgerSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Analyses the FEC files given as arguments and prints the resulting pack as JSON.
 * Arguments starting with "--" are Spring options and are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiligenceCommandLineRunner implements CommandLineRunner {

    private final DiligenceAnalysisService analysisService;
    private final DiligenceReportWriter reportWriter;

    @Override
    public void run(String... args) throws IOException {
        List<LedgerSource> sources = new ArrayList<>();
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                sources.add(LedgerSource.of(Path.of(arg)));
            }
        }
        if (sources.isEmpty()) {
            log.debug("No ledger file given, nothing to analyse");
            return;
        }

        log.info("Analysing {} ledger file(s)", sources.size());
        DiligencePack pack = analysisService.analyze(sources, List.of());
        print(pack, System.out);
    }

    void print(DiligencePack pack, PrintStream out) throws IOException {
        reportWriter.write(pack, out);
        out.println();
        out.flush();
    }
}
