package com.slotframe.api.component;

import java.util.Map;

/**
 * 同步初始化能力
 * init 返回即表示组件已就绪。
 */
public interface Initializable {

    void init(Map<String, Object> params);
}
