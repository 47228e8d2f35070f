package com.slotframe.api.component;

import java.util.Map;
import java.util.Objects;

/**
 * 函数组件包装器
 * <p>
 * 由 {@link ComponentFunction} 合成的单方法组件：
 * <ul>
 * <li>{@link #init(Map)} 以最终参数调用一次原函数</li>
 * <li>{@link #getResult()} 原样返回该次调用的结果</li>
 * </ul>
 * 每个实例独立保存结果，同一函数创建的多个实例之间不共享状态。
 */
public final class FunctionComponent implements UserComponent, Initializable {

    private final ComponentFunction function;
    private Object result;
    private boolean initialised;

    public FunctionComponent(ComponentFunction function) {
        this.function = Objects.requireNonNull(function, "function");
    }

    @Override
    public void init(Map<String, Object> params) {
        this.result = function.apply(params);
        this.initialised = true;
    }

    /**
     * 原函数的返回值；init 之前为 null
     */
    public Object getResult() {
        return result;
    }

    public boolean isInitialised() {
        return initialised;
    }

    public ComponentFunction getFunction() {
        return function;
    }

    @Override
    public void destroy() {
        this.result = null;
    }
}
