package com.scorebot.engine.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

public interface TuningParameterMapper {
    @Insert("INSERT INTO tuning_parameters(effective_date, name, value, description, created_at) " +
            "VALUES(#{effectiveDate}, #{name}, #{value}, #{description}, #{createdAt})")
    int insert(TuningParameterRow row);

    @Select("SELECT DISTINCT ON (name) effective_date, name, value, description, created_at " +
            "FROM tuning_parameters WHERE effective_date <= #{asOf} " +
            "ORDER BY name, effective_date DESC")
    List<TuningParameterRow> selectCurrent(@Param("asOf") LocalDate asOf);

    @Select("SELECT effective_date, name, value, description, created_at " +
            "FROM tuning_parameters WHERE name = #{name} ORDER BY effective_date ASC")
    List<TuningParameterRow> selectHistory(@Param("name") String name);

    @Select("SELECT COUNT(*) FROM tuning_parameters")
    long countAll();
}
