package com.catmepim.chartsync.action;

import java.io.IOException;
import java.io.PrintStream;

import com.catmepim.chartsync.DocxChartEditor;
import com.catmepim.chartsync.config.ChartSyncConfig;
import com.catmepim.chartsync.io.ChartDataJsonCodec;
import com.catmepim.chartsync.model.ChartData;

/**
 * Prints the cached data of one chart as JSON.
 */
public class ReadChartAction implements ChartAction {

    private final ChartDataJsonCodec codec;

    public ReadChartAction(ChartDataJsonCodec codec) {
        this.codec = codec;
    }

    @Override
    public void execute(DocxChartEditor editor, ChartSyncConfig config, PrintStream out) throws IOException {
        ChartData data = editor.getChartData(config.chartIndex);
        out.println(codec.toJson(data));
    }

    @Override
    public boolean mutatesPackage() {
        return false;
    }
}
