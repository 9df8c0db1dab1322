package org.retailpos.routing;

import org.retailpos.config.PosProperties;
import org.retailpos.scanner.ScreenId;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * 按页面配置的重复投递抑制窗口
 */
@Component
public class DedupPolicy {

    private final Map<ScreenId, Duration> windows;
    private final Duration defaultWindow;

    @Autowired
    public DedupPolicy(PosProperties properties) {
        this(properties.getRouting().getDedupWindows(), properties.getRouting().getDefaultDedupWindow());
    }

    public DedupPolicy(Map<ScreenId, Duration> windows, Duration defaultWindow) {
        this.windows = windows.isEmpty() ? new EnumMap<>(ScreenId.class) : new EnumMap<>(windows);
        this.defaultWindow = defaultWindow;
    }

    public long windowMillis(ScreenId screen) {
        return windows.getOrDefault(screen, defaultWindow).toMillis();
    }
}
