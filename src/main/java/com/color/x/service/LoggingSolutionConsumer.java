package com.color.x.service;

import com.color.x.dto.SolutionSummary;
import com.color.x.utils.basic.BasicUtility;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Slf4j
@Component
public class LoggingSolutionConsumer implements SolutionConsumer {

    @Override
    public void accept(SolutionSummary summary) {
        if (summary.isSolved()) {
            log.info("Graph={} algorithm={} status={} nodes={} density={} colors={} time={}",
                    summary.getGraphName(), summary.getAlgorithm(), summary.getStatus(), summary.getNumNodes(),
                    String.format(Locale.ROOT, "%.3f", summary.getEdgeDensity()),
                    summary.getNumColors(), BasicUtility.formatSeconds(summary.getDuration()));
        } else {
            log.info("Graph={} algorithm={} status={} nodes={} density={} time={}",
                    summary.getGraphName(), summary.getAlgorithm(), summary.getStatus(), summary.getNumNodes(),
                    String.format(Locale.ROOT, "%.3f", summary.getEdgeDensity()),
                    BasicUtility.formatSeconds(summary.getDuration()));
        }
        if (log.isDebugEnabled()) {
            log.debug("Solution summary: {}", BasicUtility.stringifyObject(summary));
        }
    }
}
