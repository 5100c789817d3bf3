package com.catmepim.chartsync.action;

import java.io.IOException;
import java.io.PrintStream;

import com.catmepim.chartsync.DocxChartEditor;
import com.catmepim.chartsync.config.ChartSyncConfig;

/**
 * One command-line action run against an opened document.
 */
public interface ChartAction {

    /**
     * Runs the action and prints its result.
     *
     * @param editor opened document
     * @param config validated configuration
     * @param out destination of the printed result
     * @throws IOException if input data cannot be read or the result cannot be written
     * @pre editor is open and config has been validated
     * @post if {@link #mutatesPackage()} is false, the document is unchanged
     */
    void execute(DocxChartEditor editor, ChartSyncConfig config, PrintStream out) throws IOException;

    /**
     * @return true when the document has to be saved to {@code --output} afterwards
     */
    boolean mutatesPackage();
}
