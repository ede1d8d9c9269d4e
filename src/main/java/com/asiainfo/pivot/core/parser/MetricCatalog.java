package com.asiainfo.pivot.core.parser;

import com.asiainfo.pivot.core.exception.FormulaCompileException;
import com.asiainfo.pivot.core.model.MetricDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * 编译后的指标目录
 * 构造时即完成全部公式的解析、引用校验与循环依赖检测，之后只读，可在线程间共享。
 */
public class MetricCatalog {

    private static final Logger log = LoggerFactory.getLogger(MetricCatalog.class);

    static final int MAX_DEPTH = 50;

    private final Map<String, MetricDef> metrics = new LinkedHashMap<>();
    private final Map<String, Expr> compiled = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    private final List<String> evaluationOrder;

    public MetricCatalog(List<MetricDef> definitions) {
        for (MetricDef def : definitions) {
            if (metrics.putIfAbsent(def.id(), def) != null) {
                throw new FormulaCompileException(def.id(), "duplicate metric id");
            }
        }
        for (MetricDef def : metrics.values()) {
            if (def.isVolume()) {
                dependencies.put(def.id(), Set.of());
                continue;
            }
            Expr expr = FormulaParser.parse(def.id(), def.formula());
            Set<String> refs = new LinkedHashSet<>();
            expr.collectReferences(refs);
            for (String ref : refs) {
                if (!metrics.containsKey(ref)) {
                    throw new FormulaCompileException(def.id(), "references unknown metric '" + ref + "'");
                }
            }
            compiled.put(def.id(), expr);
            dependencies.put(def.id(), Collections.unmodifiableSet(refs));
        }

        List<String> order = new ArrayList<>();
        Set<String> done = new LinkedHashSet<>();
        for (String id : compiled.keySet()) {
            visit(id, new LinkedHashSet<>(), done, order, 0);
        }
        this.evaluationOrder = Collections.unmodifiableList(order);
        log.debug("Compiled metric catalog: {} metrics, derived evaluation order {}", metrics.size(), order);
    }

    /**
     * 深度优先拓扑排序，path 为当前递归路径，用于发现循环
     */
    private void visit(String id, Set<String> path, Set<String> done, List<String> order, int depth) {
        if (depth > MAX_DEPTH) {
            throw new FormulaCompileException(id, "expression depth limit exceeded");
        }
        if (done.contains(id) || !compiled.containsKey(id)) {
            return;
        }
        if (!path.add(id)) {
            List<String> cycle = new ArrayList<>(path);
            cycle.add(id);
            String msg = "circular dependency detected: " + String.join(" -> ", cycle.subList(cycle.indexOf(id), cycle.size()));
            log.error("Metric {}: {}", id, msg);
            throw new FormulaCompileException(id, msg);
        }
        for (String dep : dependencies.get(id)) {
            visit(dep, path, done, order, depth + 1);
        }
        path.remove(id);
        done.add(id);
        order.add(id);
    }

    public List<String> ids() {
        return new ArrayList<>(metrics.keySet());
    }

    public boolean contains(String id) {
        return metrics.containsKey(id);
    }

    public Optional<MetricDef> find(String id) {
        return Optional.ofNullable(metrics.get(id));
    }

    public MetricDef get(String id) {
        MetricDef def = metrics.get(id);
        if (def == null) {
            throw new IllegalArgumentException("Unknown metric: " + id);
        }
        return def;
    }

    public boolean isVolume(String id) {
        MetricDef def = metrics.get(id);
        return def != null && def.isVolume();
    }

    public List<String> volumeMetricIds() {
        return metrics.values().stream().filter(MetricDef::isVolume).map(MetricDef::id).toList();
    }

    public Set<String> dependenciesOf(String id) {
        return dependencies.getOrDefault(id, Set.of());
    }

    /**
     * 请求指标的传递闭包中的 volume 指标，按目录顺序返回；未知ID忽略
     */
    public List<String> requiredVolumeMetrics(Collection<String> requested) {
        Set<String> volumes = new LinkedHashSet<>();
        for (String id : requested) {
            collectVolumes(id, volumes, new LinkedHashSet<>());
        }
        List<String> ordered = new ArrayList<>();
        for (String id : metrics.keySet()) {
            if (volumes.contains(id)) {
                ordered.add(id);
            }
        }
        return ordered;
    }

    private void collectVolumes(String id, Set<String> into, Set<String> seen) {
        MetricDef def = metrics.get(id);
        if (def == null || !seen.add(id)) {
            return;
        }
        if (def.isVolume()) {
            into.add(id);
            return;
        }
        for (String dep : dependencies.get(id)) {
            collectVolumes(dep, into, seen);
        }
    }

    /**
     * 请求指标涉及的派生指标 (含间接依赖)，按依赖先后排序
     */
    public List<String> derivedClosure(Collection<String> requested) {
        Set<String> needed = new LinkedHashSet<>();
        for (String id : requested) {
            collectDerived(id, needed);
        }
        return evaluationOrder.stream().filter(needed::contains).toList();
    }

    private void collectDerived(String id, Set<String> into) {
        if (!compiled.containsKey(id) || !into.add(id)) {
            return;
        }
        for (String dep : dependencies.get(id)) {
            collectDerived(dep, into);
        }
    }

    public List<String> evaluationOrder() {
        return evaluationOrder;
    }

    /**
     * 计算一个派生指标；依赖的派生指标需已写入 lookup 所读的行中
     */
    public double evaluate(String id, Function<String, Double> lookup) {
        Expr expr = compiled.get(id);
        if (expr == null) {
            throw new IllegalArgumentException("Metric " + id + " is not a derived metric");
        }
        return expr.evaluate(lookup);
    }
}
