package com.video.annotator.store;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 导入结果统计
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportSummary {

    private int imported;
    private int skipped;
}
