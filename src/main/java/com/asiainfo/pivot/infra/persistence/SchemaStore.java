package com.asiainfo.pivot.infra.persistence;

import com.asiainfo.pivot.core.model.SchemaSnapshot;

import java.util.Optional;

/**
 * schema 配置存储的只读视图
 */
public interface SchemaStore {

    Optional<SchemaSnapshot> load(String table);
}
