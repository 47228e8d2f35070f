package com.slotframe.api.annotation;

import java.lang.annotation.*;

/**
 * 组件外部依赖槽位
 * 组件创建后、初始化前由框架注入共享协作者。
 * * 示例：
 * @Autowired
 * private RowModel rowModel;
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Autowired {

    /**
     * 协作者名称 (可选)
     * 如果不指定，按字段类型查找。
     */
    String value() default "";

    /**
     * 找不到协作者时是否跳过
     */
    boolean optional() default false;
}
