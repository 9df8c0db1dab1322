package org.retailpos.controller.dto;

import lombok.Data;
import org.retailpos.scanner.KeyStroke;

import java.util.ArrayList;
import java.util.List;

/**
 * 一批按键（按到达顺序处理）
 */
@Data
public class KeyBatchRequest {
    private List<KeyStroke> keys = new ArrayList<>();
}
