package com.libragraph.synthesis.core.dao;

import com.libragraph.synthesis.core.job.JobType;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class JobTypeColumnMapper implements ColumnMapper<JobType> {

    @Override
    public JobType map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        return JobType.fromWireName(r.getString(columnNumber));
    }
}
