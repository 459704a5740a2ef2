package com.sunny.cron.worker.service;

import com.sunny.cron.core.model.JobLog;
import com.sunny.cron.worker.domain.entity.JobLogEntity;
import com.sunny.cron.worker.domain.mapper.JobLogMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * MybatisJobLogStore 单元测试
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
public class MybatisJobLogStoreTest {

    @Test
    @SuppressWarnings("unchecked")
    public void logsAreConvertedToEntities() {
        JobLogMapper mapper = mock(JobLogMapper.class);
        MybatisJobLogStore store = new MybatisJobLogStore(mapper);

        store.insertBatch(List.of(new JobLog("job1", "echo 1", "exit status 1", "1\n", 1000L, 1001L, 1002L, 1003L)));

        ArgumentCaptor<List<JobLogEntity>> captor = ArgumentCaptor.forClass(List.class);
        verify(mapper).insertBatch(captor.capture());
        JobLogEntity entity = captor.getValue().get(0);
        assertEquals("job1", entity.getJobName());
        assertEquals("exit status 1", entity.getErr());
        assertEquals(1000L, entity.getPlanTime());
        assertEquals(1003L, entity.getEndTime());
    }

    @Test
    public void emptyBatchSkipsDatabase() {
        JobLogMapper mapper = mock(JobLogMapper.class);

        new MybatisJobLogStore(mapper).insertBatch(List.of());

        verify(mapper, never()).insertBatch(anyList());
    }

    @Test
    public void mapperFailurePropagates() {
        JobLogMapper mapper = mock(JobLogMapper.class);
        when(mapper.insertBatch(anyList())).thenThrow(new IllegalStateException("db down"));

        assertThrows(IllegalStateException.class,
                () -> new MybatisJobLogStore(mapper).insertBatch(List.of(
                        new JobLog("job1", "echo 1", "", "", 1L, 1L, 1L, 1L))));
    }
}
