package com.catmepim.chartsync.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.config.ChartSyncConfig;
import com.catmepim.chartsync.io.ChartDataJsonCodec;

/**
 * Selects the {@link ChartAction} for the configured {@code --action}.
 */
public class ActionSelector {

    private static final Logger logger = LoggerFactory.getLogger(ActionSelector.class);

    /**
     * @pre config != null and has been validated
     * @post a non-null action is returned
     */
    public ChartAction select(ChartSyncConfig config) {
        ChartDataJsonCodec codec = new ChartDataJsonCodec(config.prettyPrint);
        ChartAction action;
        switch (config.action) {
            case READ:
                action = new ReadChartAction(codec);
                break;
            case UPDATE:
                action = new UpdateChartAction(codec);
                break;
            case COPY:
                action = new CopyChartAction();
                break;
            case COUNT:
                action = new CountChartsAction();
                break;
            default:
                throw new IllegalArgumentException("Unsupported action: " + config.action);
        }
        logger.debug("Action {} handled by {}", config.action, action.getClass().getSimpleName());
        return action;
    }
}
