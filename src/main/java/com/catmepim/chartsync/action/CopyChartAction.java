package com.catmepim.chartsync.action;

import java.io.PrintStream;

import com.catmepim.chartsync.DocxChartEditor;
import com.catmepim.chartsync.config.ChartSyncConfig;

/**
 * Duplicates one chart together with its workbook and prints the new chart index.
 */
public class CopyChartAction implements ChartAction {

    @Override
    public void execute(DocxChartEditor editor, ChartSyncConfig config, PrintStream out) {
        int newIndex = editor.copyChart(config.chartIndex);
        out.println(newIndex);
    }

    @Override
    public boolean mutatesPackage() {
        return true;
    }
}
