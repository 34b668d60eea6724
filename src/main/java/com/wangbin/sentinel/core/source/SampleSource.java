package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.common.exception.SampleSourceException;
import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.engine.model.SeriesKey;

import java.time.Instant;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;

/**
 * 样本数据源接口
 *
 * 约定：
 * 1. 同一分区（measurement, field, instance）内的样本按时间非递减顺序返回
 * 2. 没有样本不是错误，返回空迭代器
 * 3. 读取失败抛出 {@link SampleSourceException}，重试由数据源适配器负责
 * 4. 返回的迭代器允许阻塞（推送模式），调用方通过线程中断取消
 */
public interface SampleSource {

    /**
     * 获取数据源名称
     *
     * @return 数据源名称
     */
    String getName();

    /**
     * 打开一个分区的样本流
     *
     * @param query 分区与时间范围
     * @return 时间有序的样本迭代器
     * @throws SampleSourceException 读取失败时抛出
     */
    Iterator<Sample> open(SampleQuery query);

    /**
     * 打开样本流，数据源空闲等待时通过 progress 报告已推进到的时间，
     * 调用方据此推进水位线。默认不报告。
     */
    default Iterator<Sample> open(SampleQuery query, Consumer<Instant> progress) {
        return open(query);
    }

    /**
     * 发现某个 measurement.field 在时间范围内出现过的实例标签，
     * 不带实例标签的样本以 null 表示
     *
     * @throws SampleSourceException 读取失败时抛出
     */
    List<String> discoverInstances(String measurement, String field, TimeRange timeRange);

    /**
     * 是否支持启动时发现实例。不支持时检查定义必须指定实例
     */
    default boolean supportsInstanceDiscovery() {
        return true;
    }

    /**
     * 引擎启动前声明将要读取的分区
     */
    default void declarePartitions(Collection<SeriesKey> partitions) {
    }
}
