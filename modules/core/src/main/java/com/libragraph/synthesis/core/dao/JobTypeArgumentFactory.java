package com.libragraph.synthesis.core.dao;

import com.libragraph.synthesis.core.job.JobType;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

/** Binds a {@link JobType} as its wire name. */
public class JobTypeArgumentFactory extends AbstractArgumentFactory<JobType> {

    public JobTypeArgumentFactory() {
        super(Types.VARCHAR);
    }

    @Override
    protected Argument build(JobType value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setString(position, value.wireName());
    }
}
