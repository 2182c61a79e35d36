package com.healthion.bff.repository;

import static com.healthion.common.JdbcTimestampUtils.toInstant;
import static com.healthion.common.JdbcTimestampUtils.toTimestamp;

import com.healthion.bff.model.UserRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class UserRepository {

  private static final String COLUMNS =
      "id, external_identity_id, email, upstream_user_id, created_at, updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserRecord> findById(String id) {
    final String sql = "SELECT " + COLUMNS + " FROM users WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<UserRecord> findByExternalIdentityId(String externalIdentityId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM users WHERE external_identity_id = :externalIdentityId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("externalIdentityId", externalIdentityId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int insertIfAbsent(UserRecord user) {
    // external_identity_id の競合のみ吸収する。email の一意制約違反は呼び出し側へ伝播させる。
    final String sql =
        """
        INSERT INTO users (id, external_identity_id, email, upstream_user_id, created_at, updated_at)
        VALUES (:id, :externalIdentityId, :email, NULL, :createdAt, :updatedAt)
        ON CONFLICT (external_identity_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", user.id())
            .addValue("externalIdentityId", user.externalIdentityId())
            .addValue("email", user.email())
            .addValue("createdAt", toTimestamp(user.createdAt()))
            .addValue("updatedAt", toTimestamp(user.updatedAt()));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<UserRecord> updateEmail(String id, String email, Instant updatedAt) {
    final String sql =
        """
        UPDATE users
        SET email = :email,
            updated_at = :updatedAt
        WHERE id = :id
        RETURNING id, external_identity_id, email, upstream_user_id, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("email", email)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * upstream_user_id が NULL の場合に限り値を設定する。
   *
   * <p>単一の UPDATE 文で判定と書き込みを行うため、同一行への同時更新のうち反映されるのは 1 件のみ。
   *
   * @return 更新件数 (0 または 1)
   */
  public int linkUpstreamUserIfAbsent(String id, String upstreamUserId, Instant updatedAt) {
    final String sql =
        """
        UPDATE users
        SET upstream_user_id = :upstreamUserId,
            updated_at = :updatedAt
        WHERE id = :id
          AND upstream_user_id IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("upstreamUserId", upstreamUserId)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getString("id"),
        rs.getString("external_identity_id"),
        rs.getString("email"),
        rs.getString("upstream_user_id"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
