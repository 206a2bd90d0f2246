package cn.bitsleep.recipebook.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Entity
@Table(name = "rating", uniqueConstraints = {
        @UniqueConstraint(name = "uq_rating_user_recipe", columnNames = {"user_id", "recipe_id"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Rating {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "recipe_id", nullable = false, updatable = false)
    private Recipe recipe;

    @Column(name = "score", nullable = false)
    private Integer score; // 1..5

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
