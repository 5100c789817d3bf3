package com.catmepim.chartsync.action;

import java.io.PrintStream;

import com.catmepim.chartsync.DocxChartEditor;
import com.catmepim.chartsync.config.ChartSyncConfig;

public class CountChartsAction implements ChartAction {

    @Override
    public void execute(DocxChartEditor editor, ChartSyncConfig config, PrintStream out) {
        out.println(editor.getChartCount());
    }

    @Override
    public boolean mutatesPackage() {
        return false;
    }
}
