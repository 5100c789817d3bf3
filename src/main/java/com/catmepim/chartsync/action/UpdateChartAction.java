package com.catmepim.chartsync.action;

import java.io.IOException;
import java.io.PrintStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.DocxChartEditor;
import com.catmepim.chartsync.config.ChartSyncConfig;
import com.catmepim.chartsync.io.ChartDataJsonCodec;
import com.catmepim.chartsync.model.ChartData;
import com.catmepim.chartsync.model.ChartUpdateResult;

/**
 * Replaces the data of one chart with the contents of {@code --data} and prints the
 * update result as JSON.
 */
public class UpdateChartAction implements ChartAction {

    private static final Logger logger = LoggerFactory.getLogger(UpdateChartAction.class);

    private final ChartDataJsonCodec codec;

    public UpdateChartAction(ChartDataJsonCodec codec) {
        this.codec = codec;
    }

    @Override
    public void execute(DocxChartEditor editor, ChartSyncConfig config, PrintStream out) throws IOException {
        ChartData data = codec.read(config.dataFile);
        ChartUpdateResult result = editor.updateChart(config.chartIndex, data);
        if (result.hasIgnoredTitles()) {
            logger.warn("Some requested titles have no anchor in chart {} and were not applied", config.chartIndex);
        }
        out.println(codec.toJson(result));
    }

    @Override
    public boolean mutatesPackage() {
        return true;
    }
}
