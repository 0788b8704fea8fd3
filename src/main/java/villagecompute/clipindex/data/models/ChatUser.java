package villagecompute.clipindex.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Author of indexed messages. Written only through
 * {@link villagecompute.clipindex.data.bulk.BulkWriteRepository}.
 */
@Entity
@Table(
        name = "chat_users")
public class ChatUser extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public String id;

    @Column(
            name = "username",
            nullable = false)
    public String username;

    @Column(
            name = "discriminator")
    public String discriminator;

    @Column(
            name = "avatar_url")
    public String avatarUrl;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;
}
