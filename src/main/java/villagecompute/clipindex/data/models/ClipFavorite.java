package villagecompute.clipindex.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

@Entity
@Table(
        name = "clip_favorites",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_clip_favorites_user_clip",
                columnNames = { "user_id", "clip_id" }))
public class ClipFavorite extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    public Long id;

    @Column(
            name = "user_id",
            nullable = false)
    public String userId;

    @Column(
            name = "clip_id",
            nullable = false)
    public String clipId;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;
}
