package com.enterprise.autosave.repository;

import com.enterprise.autosave.core.DownloadTask;
import com.enterprise.autosave.core.TaskFields;
import com.enterprise.autosave.exception.TaskNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapdb.Atomic;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * MapDB-based task repository. Tasks are stored as JSON documents keyed by id; every
 * write is committed as its own transaction.
 */
public class MapDBTaskRepository implements TaskRepository, AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(MapDBTaskRepository.class);
    
    private final DB db;
    private final ConcurrentNavigableMap<Long, String> tasks;
    private final Atomic.Long idSequence;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock;
    
    private MapDBTaskRepository(DB db, String description) {
        this.db = db;
        this.lock = new ReentrantReadWriteLock();
        
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        
        this.tasks = db.treeMap("tasks", Serializer.LONG, Serializer.STRING).createOrOpen();
        this.idSequence = db.atomicLong("taskIdSequence").createOrOpen();
        
        logger.info("MapDB task repository opened ({}) with {} tasks", description, tasks.size());
    }
    
    /**
     * Open (or create) a file-backed repository
     */
    public static MapDBTaskRepository open(String dbPath) {
        Path path = Path.of(dbPath).toAbsolutePath();
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create directory for task database " + path, e);
        }
        
        DB db = DBMaker.fileDB(new File(path.toString()))
            .transactionEnable()
            .closeOnJvmShutdown()
            .make();
        return new MapDBTaskRepository(db, path.toString());
    }
    
    /**
     * Repository that lives only as long as the process
     */
    public static MapDBTaskRepository inMemory() {
        DB db = DBMaker.memoryDB()
            .transactionEnable()
            .make();
        return new MapDBTaskRepository(db, "in-memory");
    }
    
    @Override
    public Optional<DownloadTask> get(long id) {
        lock.readLock().lock();
        try {
            String serialized = tasks.get(id);
            return serialized != null ? deserializeTask(serialized) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public List<DownloadTask> list() {
        lock.readLock().lock();
        try {
            return tasks.descendingMap().values().stream()
                .map(this::deserializeTask)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public List<DownloadTask> listActive() {
        return list().stream()
            .filter(DownloadTask::isActive)
            .collect(Collectors.toList());
    }
    
    @Override
    public DownloadTask create(TaskFields fields) {
        lock.writeLock().lock();
        try {
            DownloadTask task = DownloadTask.builder()
                .id(idSequence.incrementAndGet())
                .name(fields.getName())
                .targetUrl(fields.getTargetUrl())
                .filenameTemplate(fields.getFilenameTemplate())
                .recurrenceExpression(fields.getRecurrenceExpression())
                .status(fields.getStatus())
                .createdAt(Instant.now())
                .build();
            
            store(task);
            logger.info("Created task {} ({})", task.getId(), task.getName());
            return task;
            
        } catch (RuntimeException e) {
            db.rollback();
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    public DownloadTask update(long id, TaskFields fields) throws TaskNotFoundException {
        lock.writeLock().lock();
        try {
            DownloadTask updated = require(id).withFields(fields);
            store(updated);
            logger.info("Updated task {} ({})", id, updated.getName());
            return updated;
            
        } catch (RuntimeException e) {
            db.rollback();
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    public boolean delete(long id) {
        lock.writeLock().lock();
        try {
            String removed = tasks.remove(id);
            if (removed == null) {
                return false;
            }
            db.commit();
            logger.info("Deleted task {}", id);
            return true;
            
        } catch (RuntimeException e) {
            logger.error("Error deleting task {}", id, e);
            db.rollback();
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    public void setLastRun(long id, Instant lastRunAt) throws TaskNotFoundException {
        lock.writeLock().lock();
        try {
            store(require(id).withLastRunAt(lastRunAt));
            logger.debug("Recorded last run of task {} at {}", id, lastRunAt);
            
        } catch (RuntimeException e) {
            db.rollback();
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    public int size() {
        lock.readLock().lock();
        try {
            return tasks.size();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Close the repository and release resources.
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!db.isClosed()) {
                db.close();
                logger.info("Task repository closed");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    private DownloadTask require(long id) throws TaskNotFoundException {
        String serialized = tasks.get(id);
        if (serialized == null) {
            throw new TaskNotFoundException(id);
        }
        return deserializeTask(serialized)
            .orElseThrow(() -> new IllegalStateException("Stored task " + id + " cannot be read"));
    }
    
    private void store(DownloadTask task) {
        try {
            tasks.put(task.getId(), objectMapper.writeValueAsString(task));
            db.commit();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task " + task.getId(), e);
        }
    }
    
    private Optional<DownloadTask> deserializeTask(String serialized) {
        try {
            return Optional.of(objectMapper.readValue(serialized, DownloadTask.class));
        } catch (JsonProcessingException e) {
            logger.error("Failed to deserialize stored task", e);
            return Optional.empty();
        }
    }
}
