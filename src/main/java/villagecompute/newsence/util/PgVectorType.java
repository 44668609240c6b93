/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsence.util;

import com.pgvector.PGvector;
import org.hibernate.HibernateException;
import org.hibernate.engine.spi.SharedSessionContractImplementor;
import org.hibernate.usertype.UserType;

import java.io.Serializable;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;

/**
 * Hibernate UserType mapping {@code float[]} item embeddings onto a pgvector {@code vector(1024)} column.
 *
 * <pre>
 * &#64;Column(
 *         name = "embedding",
 *         columnDefinition = "vector(1024)")
 * &#64;Type(PgVectorType.class)
 * public float[] embedding;
 * </pre>
 *
 * <p>
 * Native similarity queries bind the query vector as text and cast it server side, so {@link #toLiteral(float[])} is
 * exposed for them.
 *
 * @see villagecompute.newsence.data.stores.PanacheItemStore#findSimilar
 */
public class PgVectorType implements UserType<float[]> {

    @Override
    public int getSqlType() {
        return Types.OTHER;
    }

    @Override
    public Class<float[]> returnedClass() {
        return float[].class;
    }

    @Override
    public boolean equals(float[] x, float[] y) {
        return Arrays.equals(x, y);
    }

    @Override
    public int hashCode(float[] x) {
        return Arrays.hashCode(x);
    }

    @Override
    public float[] nullSafeGet(ResultSet rs, int position, SharedSessionContractImplementor session, Object owner)
            throws SQLException {
        Object value = rs.getObject(position);
        if (value == null) {
            return null;
        }
        if (value instanceof PGvector vector) {
            return vector.toArray();
        }
        return fromLiteral(value.toString());
    }

    @Override
    public void nullSafeSet(PreparedStatement st, float[] value, int index, SharedSessionContractImplementor session)
            throws SQLException {
        if (value == null) {
            st.setNull(index, Types.OTHER);
        } else {
            st.setObject(index, new PGvector(value));
        }
    }

    @Override
    public float[] deepCopy(float[] value) {
        return value == null ? null : Arrays.copyOf(value, value.length);
    }

    @Override
    public boolean isMutable() {
        return true;
    }

    @Override
    public Serializable disassemble(float[] value) {
        return deepCopy(value);
    }

    @Override
    public float[] assemble(Serializable cached, Object owner) {
        return cached == null ? null : deepCopy((float[]) cached);
    }

    /**
     * Renders a vector in pgvector's text form, e.g. {@code [0.1,0.2,0.3]}.
     *
     * @param vector
     *            the embedding
     * @return text literal accepted by {@code CAST(? AS vector)}
     */
    public static String toLiteral(float[] vector) {
        return new PGvector(vector).toString();
    }

    /**
     * Parses pgvector's text form back into a float array.
     *
     * @param literal
     *            text such as {@code [0.1,0.2]}
     * @return parsed vector
     * @throws HibernateException
     *             if the literal is not a vector
     */
    public static float[] fromLiteral(String literal) {
        try {
            String body = literal.trim();
            if (body.startsWith("[") && body.endsWith("]")) {
                body = body.substring(1, body.length() - 1);
            }
            if (body.isBlank()) {
                return new float[0];
            }
            String[] parts = body.split(",");
            float[] result = new float[parts.length];
            for (int i = 0; i < parts.length; i++) {
                result[i] = Float.parseFloat(parts[i].trim());
            }
            return result;
        } catch (NumberFormatException e) {
            throw new HibernateException("Failed to parse pgvector literal: " + literal, e);
        }
    }
}
