package com.hostsentinel.flink;

import org.apache.flink.api.java.typeutils.runtime.kryo.JavaSerializer;

import java.io.Serializable;

/**
 * Kryo serializer for the job's stream records, delegating to Java
 * serialization. Concrete so it can be registered by class literal.
 */
public class JavaRecordSerializer extends JavaSerializer<Serializable> {
}
