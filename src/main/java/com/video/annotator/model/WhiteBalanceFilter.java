package com.video.annotator.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 灰度世界白平衡（按亮度加权），无参数
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class WhiteBalanceFilter extends FilterSpec {

    private static final long serialVersionUID = 1L;

    public static final String NAME = "white_balance";
    public static final String DEFAULT_LABEL = "Balanço de Branco";

    public static WhiteBalanceFilter of(boolean enabled) {
        WhiteBalanceFilter filter = new WhiteBalanceFilter();
        filter.setLabel(DEFAULT_LABEL);
        filter.setEnabled(enabled);
        return filter;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public WhiteBalanceFilter copy() {
        return copyCommonTo(new WhiteBalanceFilter());
    }
}
