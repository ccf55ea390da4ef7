/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.relsec.core.security.filter;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.junit.Before;
import org.junit.Test;
import org.relsec.api.Decision;
import org.relsec.api.PermissionEntry;
import org.relsec.api.PermissionValue;
import org.relsec.api.PredicateFilter;
import org.relsec.api.TypeMismatchException;
import org.relsec.api.UnknownGroupException;
import org.relsec.api.constraint.ConstantConstraint;
import org.relsec.core.security.BlogPost;
import org.relsec.core.security.Comment;
import org.relsec.core.security.FeaturedPost;
import org.relsec.core.security.User;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.relsec.api.PermissionValue.ALLOW;
import static org.relsec.api.PermissionValue.DENY;

public class PredicateFilterImplTest {

    static final String EDIT = "edit";
    static final String APPROVE = "approve";

    static final String SUBMITTER_GROUP = "post-submitter";
    static final String EDITOR_GROUP = "post-editor";
    static final String EVEN_ADMIN_GROUP = "post-administrator-for-even-ids";

    private final User submitter = new User(1, "submitter");
    private final User editor = new User(2, "editor");
    private final User admin = new User(3, "admin", PermissionEntry.allow(EDIT), PermissionEntry.allow(APPROVE));
    private final User evenAdmin = new User(4, "evenAdmin");

    private final BlogPost p1 = new BlogPost(1, "P1", 1, 1);
    private final BlogPost p2 = new BlogPost(2, "P2", 1, 2);
    private final BlogPost p3 = new BlogPost(3, "P3", 3, null);
    private final BlogPost p4 = new BlogPost(4, "P4", null, null);

    private List<BlogPost> posts;

    private PredicateFilter<User> filter;

    static PredicateFilterBuilder<User, Integer> newBlogBuilder() {
        return PredicateFilterBuilder.<User, Integer>newBuilder(user -> user == null ? null : user.getId())
                .withGlobalPermissions(user -> user == null ? ImmutableList.<PermissionEntry>of() : user.getPermissions())
                .addGroup(SUBMITTER_GROUP, BlogPost.class,
                        (post, userId) -> userId != null && userId.equals(post.getSubmitterId()))
                .addPermission(SUBMITTER_GROUP, EDIT, ALLOW)
                .addPermission(SUBMITTER_GROUP, APPROVE, DENY)
                .addGroup(EDITOR_GROUP, BlogPost.class,
                        (post, userId) -> userId != null && userId.equals(post.getEditorId()))
                .addPermission(EDITOR_GROUP, EDIT, ALLOW)
                .addPermission(EDITOR_GROUP, APPROVE, ALLOW);
    }

    static List<String> titles(Iterable<BlogPost> posts) {
        List<String> titles = Lists.newArrayList();
        for (BlogPost post : posts) {
            titles.add(post.getTitle());
        }
        return titles;
    }

    @Before
    public void before() {
        posts = Lists.newArrayList(p1, p2, p3, p4);
        filter = newBlogBuilder()
                .addGroup(EVEN_ADMIN_GROUP, BlogPost.class,
                        (post, userId) -> userId != null && userId == 4 && post.getId() % 2 == 0)
                .addPermission(EVEN_ADMIN_GROUP, EDIT, ALLOW)
                .addPermission(EVEN_ADMIN_GROUP, APPROVE, ALLOW)
                .build();
    }

    private List<String> filter(String permission, User user) {
        return titles(filter.filter(posts, BlogPost.class, permission, user));
    }

    @Test
    public void testSubmitter() {
        assertEquals(ImmutableList.of("P1", "P2"), filter(EDIT, submitter));
        assertEquals(ImmutableList.of(), filter(APPROVE, submitter));
    }

    @Test
    public void testEditor() {
        assertEquals(ImmutableList.of("P2"), filter(EDIT, editor));
        assertEquals(ImmutableList.of("P2"), filter(APPROVE, editor));
    }

    @Test
    public void testAdmin() {
        assertEquals(ImmutableList.of("P1", "P2", "P3", "P4"), filter(EDIT, admin));
        // a submitter cannot approve their own post, not even an administrator
        assertEquals(ImmutableList.of("P1", "P2", "P4"), filter(APPROVE, admin));
    }

    @Test
    public void testAdminForEvenIds() {
        assertEquals(ImmutableList.of("P2", "P4"), filter(EDIT, evenAdmin));
        assertEquals(ImmutableList.of("P2", "P4"), filter(APPROVE, evenAdmin));
    }

    @Test
    public void testAnonymous() {
        assertEquals(ImmutableList.of(), filter(EDIT, null));
        assertFalse(filter.testGlobal(EDIT, null));
    }

    @Test
    public void testUnknownPermission() {
        assertEquals(ImmutableList.of(), filter("delete", admin));
        Decision<BlogPost> decision = filter.getDecision(BlogPost.class, "delete", admin);
        assertSame(ConstantConstraint.alwaysFalse(), decision.getConstraint());
        assertSame(PermissionValue.INHERIT, decision.getGlobalValue());
    }

    @Test
    public void testPermissionNamesAreCaseInsensitive() {
        assertEquals(ImmutableList.of("P1", "P2"), filter("EDIT", submitter));
        assertTrue(filter.testGlobal("Approve", admin));
    }

    @Test
    public void testGlobalDenyOverridesGroups() {
        User banned = new User(1, "banned", PermissionEntry.deny(EDIT));
        assertEquals(ImmutableList.of(), filter(EDIT, banned));
        assertEquals(PermissionValue.DENY, filter.getDecision(BlogPost.class, EDIT, banned).getGlobalValue());

        User conflicted = new User(5, "conflicted", PermissionEntry.allow(EDIT), PermissionEntry.deny("Edit"));
        assertEquals(ImmutableList.of(), filter(EDIT, conflicted));
        assertFalse(filter.testGlobal(EDIT, conflicted));
    }

    @Test
    public void testGlobalAllowWithoutGroups() {
        Comment comment = new Comment(1, 2, p1);
        assertTrue(filter.test(comment, EDIT, admin));
        assertFalse(filter.test(comment, EDIT, submitter));
        assertEquals(ImmutableList.of(comment),
                ImmutableList.copyOf(filter.filter(ImmutableList.of(comment), Comment.class, EDIT, admin)));
    }

    @Test
    public void testTestGlobal() {
        assertTrue(filter.testGlobal(EDIT, admin));
        assertFalse(filter.testGlobal(EDIT, submitter));
        assertFalse(filter.testGlobal("delete", admin));
    }

    @Test
    public void testSingleItem() {
        assertTrue(filter.test(p1, EDIT, submitter));
        assertFalse(filter.test(p3, EDIT, submitter));
        assertFalse(filter.test(p3, APPROVE, admin));
        for (BlogPost post : posts) {
            for (User user : ImmutableList.of(submitter, editor, admin, evenAdmin)) {
                assertEquals(post + "/" + user,
                        filter(APPROVE, user).contains(post.getTitle()), filter.test(post, APPROVE, user));
            }
        }
    }

    @Test
    public void testSubtypeContent() {
        FeaturedPost featured = new FeaturedPost(6, "F6", 1, null, 2);
        assertTrue(filter.test(featured, EDIT, submitter));
        assertFalse(filter.test(featured, APPROVE, submitter));
        assertTrue(filter.test(featured, EDIT, evenAdmin));

        List<FeaturedPost> featuredPosts = ImmutableList.of(featured);
        assertEquals(featuredPosts,
                ImmutableList.copyOf(filter.filter(featuredPosts, FeaturedPost.class, EDIT, submitter)));
    }

    @Test
    public void testSubtypeGroupAppliesToSupertypeCollection() {
        PredicateFilter<User> curated = newBlogBuilder()
                .addGroup("post-curator", FeaturedPost.class,
                        (post, userId) -> userId != null && userId.equals(post.getCuratorId()))
                .addPermission("post-curator", EDIT, DENY)
                .build();
        FeaturedPost selfCurated = new FeaturedPost(4, "F4", 1, null, 1);
        FeaturedPost curatedByOther = new FeaturedPost(5, "F5", 1, null, 2);
        List<BlogPost> mixed = ImmutableList.of(p1, selfCurated, curatedByOther);

        assertFalse(curated.test(selfCurated, EDIT, submitter));
        assertEquals(ImmutableList.of("P1", "F5"), titles(curated.filter(mixed, BlogPost.class, EDIT, submitter)));
        for (BlogPost post : mixed) {
            assertEquals(post.getTitle(), curated.test(post, EDIT, submitter),
                    curated.filter(ImmutableList.of(post), BlogPost.class, EDIT, submitter).iterator().hasNext());
        }
        assertEquals("edit on BlogPost: ([post-submitter] or [post-editor]) and (not [post-curator])",
                curated.getDecision(BlogPost.class, EDIT, submitter).toString());
    }

    @Test
    public void testFilterIsIdempotent() {
        Iterable<BlogPost> editable = filter.filter(posts, BlogPost.class, EDIT, submitter);
        assertEquals(titles(editable), titles(editable));
        assertEquals(titles(editable), titles(filter.filter(posts, BlogPost.class, EDIT, submitter)));
    }

    @Test
    public void testFilterIsLazy() {
        Iterable<BlogPost> editable = filter.filter(posts, BlogPost.class, EDIT, editor);
        posts.add(new BlogPost(5, "P5", null, 2));
        assertEquals(ImmutableList.of("P2", "P5"), titles(editable));
    }

    @Test
    public void testDecisionRendering() {
        assertEquals("approve on BlogPost: ([post-editor] or [post-administrator-for-even-ids])"
                        + " and (not [post-submitter])",
                filter.getDecision(BlogPost.class, APPROVE, submitter).toString());
        assertEquals("approve on BlogPost: (true or [post-editor] or [post-administrator-for-even-ids])"
                        + " and (not [post-submitter])",
                filter.getDecision(BlogPost.class, APPROVE, admin).toString());
        assertEquals("edit on Comment: true", filter.getDecision(Comment.class, EDIT, admin).toString());
    }

    @Test
    public void testIsMember() {
        assertTrue(filter.isMember(p1, SUBMITTER_GROUP, submitter));
        assertTrue(filter.isMember(p2, "POST-EDITOR", editor));
        assertFalse(filter.isMember(p3, SUBMITTER_GROUP, submitter));
        // membership ignores permissions and global entries
        assertTrue(filter.isMember(p3, SUBMITTER_GROUP, admin));
        assertFalse(filter.isMember(p1, SUBMITTER_GROUP, admin));
        assertFalse(filter.isMember(p1, SUBMITTER_GROUP, null));
    }

    @Test
    public void testIsMemberOfUnknownGroup() {
        try {
            filter.isMember(p1, "post-reviewer", submitter);
            fail("Expected UnknownGroupException");
        } catch (UnknownGroupException e) {
            assertEquals("post-reviewer", e.getGroupName());
        }
    }

    @Test(expected = TypeMismatchException.class)
    public void testIsMemberForForeignContent() {
        filter.isMember(new Comment(1, 1, p1), SUBMITTER_GROUP, submitter);
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    public void testDecisionRejectsForeignContent() {
        com.google.common.base.Predicate raw = filter.getDecision(BlogPost.class, EDIT, submitter);
        try {
            raw.apply(new Comment(1, 1, p1));
            fail("Expected TypeMismatchException");
        } catch (TypeMismatchException e) {
            assertEquals(BlogPost.class, e.getExpectedType());
            assertEquals(Comment.class, e.getActualType());
        }
    }

    @Test(expected = NullPointerException.class)
    public void testNullContent() {
        filter.test(null, EDIT, submitter);
    }
}
