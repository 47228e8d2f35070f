package com.slotframe.api.component;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * 延迟初始化能力
 * <p>
 * 适用于需要等待外部框架首次渲染等场景，返回的 Stage 完成时组件才算就绪。
 * 若同时实现了 {@link Initializable}，以本接口为准。
 */
public interface AsyncInitializable {

    CompletionStage<Void> initAsync(Map<String, Object> params);
}
